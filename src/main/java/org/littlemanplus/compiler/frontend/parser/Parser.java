package org.littlemanplus.compiler.frontend.parser;

import org.littlemanplus.compiler.api.CompilerErrorCode;
import org.littlemanplus.compiler.api.SourceInfo;
import org.littlemanplus.compiler.diagnostics.DiagnosticsEngine;
import org.littlemanplus.compiler.frontend.lexer.Token;
import org.littlemanplus.compiler.frontend.lexer.TokenType;
import org.littlemanplus.compiler.frontend.parser.ast.InstructionNode;
import org.littlemanplus.compiler.frontend.parser.ast.OperandNode;
import org.littlemanplus.runtime.Config;
import org.littlemanplus.runtime.isa.Opcode;

import java.util.ArrayList;
import java.util.List;

/**
 * The parser for the assembly language. It consumes the tokens produced by the
 * {@link org.littlemanplus.compiler.frontend.lexer.Lexer} and produces one
 * {@link InstructionNode} per non-blank line:
 * <pre>
 *   [label] MNEMONIC [operand]
 * </pre>
 * A label is any identifier that is not made up entirely of upper-case letters, so that a
 * line starting with a mnemonic is never mistaken for a labelled one. After an error the
 * parser skips to the next line and continues, so all errors of a source are reported.
 */
public class Parser {

    private final List<Token> tokens;
    private final List<String> sourceLines;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param sourceLines The source lines, used to attach line content to each node.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, List<String> sourceLines, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.sourceLines = sourceLines;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The instruction nodes in source order; lines with errors are left out.
     */
    public List<InstructionNode> parse() {
        List<InstructionNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            InstructionNode node = line();
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private InstructionNode line() {
        try {
            Token first = peek();
            Token label = null;
            if (check(TokenType.IDENTIFIER)) {
                Token candidate = advance();
                if (isReservedForMnemonics(candidate.text())) {
                    throw error(candidate, "Unknown instruction '" + candidate.text() + "'.");
                }
                label = candidate;
            }

            if (!check(TokenType.OPCODE)) {
                Token unexpected = peek();
                String found = isLineEnd(unexpected) ? "end of line" : "'" + unexpected.text() + "'";
                throw error(unexpected, "Expected instruction but got " + found + ".");
            }
            Token opcodeToken = advance();
            Opcode opcode = Opcode.fromMnemonic(opcodeToken.text()).orElseThrow();
            OperandNode operand = operand(opcode, opcodeToken);

            if (!isLineEnd(peek())) {
                throw error(peek(), "Unexpected '" + peek().text() + "' after " + opcode + ".");
            }
            return new InstructionNode(label, opcode, operand, sourceInfo(first));
        } catch (ParseError e) {
            synchronize();
            return null;
        }
    }

    private OperandNode operand(Opcode opcode, Token opcodeToken) {
        switch (opcode.kind()) {
            case FIXED:
                return null;
            case DATA:
                if (check(TokenType.NUMBER)) {
                    Token number = advance();
                    return new OperandNode.NumberOperand(number, (Long) number.value());
                }
                if (!isLineEnd(peek())) {
                    throw error(peek(), "DAT takes a numeric literal, got '" + peek().text() + "'.");
                }
                return null;
            case BAND:
                if (check(TokenType.NUMBER)) {
                    Token number = advance();
                    long value = (Long) number.value();
                    if (value < 0 || value >= Config.BAND_WIDTH) {
                        diagnostics.reportError(CompilerErrorCode.OPERAND_OUT_OF_RANGE,
                                "Operand " + value + " of " + opcode + " must be in [0, " + Config.BAND_WIDTH + ").",
                                number.fileName(), number.line());
                    }
                    return new OperandNode.NumberOperand(number, value);
                }
                if (check(TokenType.IDENTIFIER)) {
                    Token ref = advance();
                    return new OperandNode.LabelRef(ref, ref.text());
                }
                if (check(TokenType.POINTER)) {
                    Token ref = advance();
                    return new OperandNode.PointerRef(ref, (String) ref.value());
                }
                throw error(peek(), opcode + " requires an address, label or @label operand.");
            default:
                throw error(opcodeToken, "Unsupported opcode kind " + opcode.kind() + ".");
        }
    }

    private static boolean isReservedForMnemonics(String text) {
        return !text.isEmpty() && text.chars().allMatch(c -> c >= 'A' && c <= 'Z');
    }

    private SourceInfo sourceInfo(Token first) {
        int index = first.line() - 1;
        String content = index >= 0 && index < sourceLines.size() ? sourceLines.get(index) : "";
        return new SourceInfo(first.fileName(), first.line(), first.column(), content);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportError(CompilerErrorCode.SYNTAX_ERROR, message, token.fileName(), token.line());
        return new ParseError();
    }

    /**
     * Skips the rest of the current line.
     */
    private void synchronize() {
        while (!isAtEnd() && !check(TokenType.NEWLINE)) {
            advance();
        }
    }

    private boolean isLineEnd(Token token) {
        return token.type() == TokenType.NEWLINE || token.type() == TokenType.END_OF_FILE;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
