package org.littlemanplus.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during assembly.
 * This decouples the test logic from the wording of the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer & Parser Errors
    /** The source does not follow the line grammar (unexpected character, token or arity). */
    SYNTAX_ERROR,
    /** An address operand is negative or does not fit into an opcode band. */
    OPERAND_OUT_OF_RANGE,
    // endregion

    // region Linker Errors
    /** A label was referenced but not defined. */
    LABEL_NOT_FOUND,
    /** The same label was defined on more than one line. */
    DUPLICATE_LABEL
    // endregion
}
