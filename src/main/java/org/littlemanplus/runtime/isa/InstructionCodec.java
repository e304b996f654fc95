package org.littlemanplus.runtime.isa;

import org.littlemanplus.runtime.Config;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts between {@link Instruction}s and the single {@code long} stored in a memory cell.
 * <p>
 * Band opcodes are encoded as {@code base + operand}; operands must lie in
 * {@code [0, BAND_WIDTH)}. Larger operands would bleed into the next band, so they are
 * rejected instead of wrapped. {@link Opcode#DAT} encodes to its payload unchanged and is
 * never produced by {@link #decode(long)}.
 */
public final class InstructionCodec {

    private static final List<Opcode> FIXED_CODES = Arrays.stream(Opcode.values())
            .filter(op -> op.kind() == Opcode.Kind.FIXED)
            .collect(Collectors.toUnmodifiableList());

    private static final List<Opcode> BANDS_ASCENDING = Arrays.stream(Opcode.values())
            .filter(Opcode::takesAddress)
            .sorted(Comparator.comparingInt(Opcode::code))
            .collect(Collectors.toUnmodifiableList());

    private InstructionCodec() {}

    /**
     * Encodes an instruction into a cell value.
     * @param instruction The instruction to encode.
     * @return The cell value.
     * @throws IllegalArgumentException if the operand does not fit the opcode.
     */
    public static long encode(Instruction instruction) {
        Opcode opcode = instruction.opcode();
        long operand = instruction.operand();
        switch (opcode.kind()) {
            case DATA:
                return operand;
            case FIXED:
                if (operand != 0) {
                    throw new IllegalArgumentException(opcode + " takes no operand, got " + operand);
                }
                return opcode.code();
            case BAND:
                if (operand < 0 || operand >= Config.BAND_WIDTH) {
                    throw new IllegalArgumentException(
                            "Operand " + operand + " of " + opcode + " outside [0, " + Config.BAND_WIDTH + ")");
                }
                return opcode.code() + operand;
            default:
                throw new IllegalStateException("Unhandled opcode kind: " + opcode.kind());
        }
    }

    /**
     * Decodes a cell value. Fixed codes are matched first, then the bands in ascending order.
     * @param value The cell value.
     * @return The decoded instruction, never {@link Opcode#DAT}.
     * @throws UnknownOpcodeException if the value matches no fixed code or band.
     */
    public static Instruction decode(long value) throws UnknownOpcodeException {
        for (Opcode opcode : FIXED_CODES) {
            if (value == opcode.code()) {
                return Instruction.of(opcode);
            }
        }
        for (Opcode opcode : BANDS_ASCENDING) {
            long operand = value - opcode.code();
            if (operand >= 0 && operand < Config.BAND_WIDTH) {
                return Instruction.of(opcode, operand);
            }
        }
        throw new UnknownOpcodeException(value);
    }

    /**
     * Renders a cell for display: its instruction if it decodes, otherwise {@code DAT value}.
     * @param value The cell value.
     * @return Assembly text for the cell.
     */
    public static String disassemble(long value) {
        try {
            return decode(value).toString();
        } catch (UnknownOpcodeException e) {
            return Instruction.of(Opcode.DAT, value).toString();
        }
    }
}
