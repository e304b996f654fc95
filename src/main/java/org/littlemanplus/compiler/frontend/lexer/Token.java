package org.littlemanplus.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (the {@code Long} of a number, the label of a pointer).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the program the token belongs to.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
}
