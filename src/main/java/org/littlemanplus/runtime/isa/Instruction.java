package org.littlemanplus.runtime.isa;

import java.util.Objects;

/**
 * A resolved machine instruction: an opcode and its numeric operand.
 * <p>
 * For fixed opcodes the operand is always {@code 0}. For {@link Opcode#DAT} the operand
 * is the literal cell value, which may be any {@code long}.
 *
 * @param opcode The opcode.
 * @param operand The resolved operand (address, indirection marker or data literal).
 */
public record Instruction(Opcode opcode, long operand) {

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
    }

    /**
     * Creates an instruction without an operand.
     * @param opcode A fixed opcode.
     * @return The instruction.
     */
    public static Instruction of(Opcode opcode) {
        return new Instruction(opcode, 0);
    }

    /**
     * Creates an instruction with an operand.
     * @param opcode The opcode.
     * @param operand The operand.
     * @return The instruction.
     */
    public static Instruction of(Opcode opcode, long operand) {
        return new Instruction(opcode, operand);
    }

    /**
     * Renders the instruction in assembly syntax, e.g. {@code ADD 12} or {@code HLT}.
     */
    @Override
    public String toString() {
        if (opcode.kind() == Opcode.Kind.FIXED) {
            return opcode.name();
        }
        return opcode.name() + " " + operand;
    }
}
