package org.littlemanplus.compiler.frontend.lexer;

import org.littlemanplus.compiler.api.CompilerErrorCode;
import org.littlemanplus.compiler.diagnostics.DiagnosticsEngine;
import org.littlemanplus.runtime.isa.Opcode;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Indentation and blank lines carry no meaning; newlines are kept as tokens because the
 * grammar is line based.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the program being assembled, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        start = current;
        addToken(TokenType.END_OF_FILE, null, "");
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '@':
                pointer();
                break;
            case '-':
                if (isDigit(peek())) {
                    number();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
            case ' ', '\r', '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                lineStart = current;
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = Opcode.fromMnemonic(text).isPresent() ? TokenType.OPCODE : TokenType.IDENTIFIER;
        addToken(type);
    }

    private void pointer() {
        if (!isAlpha(peek())) {
            error("Expected a label name after '@'");
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(TokenType.POINTER, text.substring(1), text);
    }

    private void number() {
        while (isDigit(peek())) advance();
        String numberString = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(numberString), numberString);
        } catch (NumberFormatException e) {
            error("Invalid number format: " + numberString);
        }
    }

    private void error(String message) {
        diagnostics.reportError(CompilerErrorCode.SYNTAX_ERROR, message, logicalFileName, line);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null, source.substring(start, current));
    }

    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, line, start - lineStart + 1, logicalFileName));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
