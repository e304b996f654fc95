package org.littlemanplus.compiler.frontend.parser.ast;

import org.littlemanplus.compiler.frontend.lexer.Token;

/**
 * The still symbolic operand of an instruction, as written in the source.
 * The {@link org.littlemanplus.compiler.backend.link.Linker} turns it into a number.
 */
public sealed interface OperandNode permits OperandNode.NumberOperand, OperandNode.LabelRef, OperandNode.PointerRef {

    /**
     * @return The token the operand was parsed from.
     */
    Token token();

    /**
     * A numeric literal.
     * @param token The NUMBER token.
     * @param value The literal value.
     */
    record NumberOperand(Token token, long value) implements OperandNode {}

    /**
     * A bare identifier: the address of a label.
     * @param token The IDENTIFIER token.
     * @param name The label name.
     */
    record LabelRef(Token token, String name) implements OperandNode {}

    /**
     * An {@code @identifier}: the indirection marker for the cell at the label.
     * @param token The POINTER token.
     * @param name The label name without '@'.
     */
    record PointerRef(Token token, String name) implements OperandNode {}
}
