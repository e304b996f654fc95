package org.littlemanplus.compiler.frontend.parser.ast;

import org.littlemanplus.compiler.api.SourceInfo;
import org.littlemanplus.compiler.frontend.lexer.Token;
import org.littlemanplus.runtime.isa.Opcode;

import java.util.Objects;
import java.util.Optional;

/**
 * An AST node that represents one source line: an optional label and a single instruction.
 * The position of the node in the parsed list is its memory address.
 *
 * @param label The label token, or {@code null} if the line has none.
 * @param opcode The instruction's opcode.
 * @param operand The symbolic operand, or {@code null} for opcodes without one.
 * @param source The source position of the line.
 */
public record InstructionNode(
        Token label,
        Opcode opcode,
        OperandNode operand,
        SourceInfo source
) {

    public InstructionNode {
        Objects.requireNonNull(opcode, "opcode");
        Objects.requireNonNull(source, "source");
    }

    public Optional<String> labelName() {
        return Optional.ofNullable(label).map(Token::text);
    }

    public Optional<OperandNode> operandNode() {
        return Optional.ofNullable(operand);
    }
}
