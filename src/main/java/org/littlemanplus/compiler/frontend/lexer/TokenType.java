package org.littlemanplus.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier that is not a mnemonic: a label definition or reference. */
    IDENTIFIER,
    /** An {@code @identifier} pointer reference; the value is the identifier without '@'. */
    POINTER,
    /** A decimal numeric literal; the value is a {@link Long}. */
    NUMBER,

    // Keywords.
    /** A mnemonic, such as ADD or HLT. */
    OPCODE,

    // Miscellaneous.
    /** A newline character. */
    NEWLINE,
    /** Represents the end of the source. */
    END_OF_FILE
}
