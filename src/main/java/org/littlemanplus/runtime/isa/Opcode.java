package org.littlemanplus.runtime.isa;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of instructions understood by the machine.
 * <p>
 * Each opcode either owns a fixed numeric code ({@link Kind#FIXED}) or a band of
 * {@link org.littlemanplus.runtime.Config#BAND_WIDTH} codes obtained by adding its base
 * to the operand ({@link Kind#BAND}). {@link #DAT} is a pseudo-instruction whose payload
 * is written verbatim into memory.
 */
public enum Opcode {
    /** Stop the program. */
    HLT(1, Kind.FIXED),
    /** Add the referenced cell to the accumulator. */
    ADD(1000, Kind.BAND),
    /** Subtract the referenced cell from the accumulator. */
    SUB(2000, Kind.BAND),
    /** Store the accumulator into the referenced cell. */
    STA(3000, Kind.BAND),
    /** Load the cell whose address is held in the accumulator. */
    LDR(4000, Kind.FIXED),
    /** Load the referenced cell into the accumulator. */
    LDA(5000, Kind.BAND),
    /** Branch always. */
    BRA(6000, Kind.BAND),
    /** Branch if the accumulator is zero. */
    BRZ(7000, Kind.BAND),
    /** Branch if the accumulator is zero or positive. */
    BRP(8000, Kind.BAND),
    /** Read one input value into the accumulator. */
    INP(901, Kind.FIXED),
    /** Output the accumulator. */
    OUT(902, Kind.FIXED),
    /** Bitwise NOT of the accumulator. */
    BWN(10000, Kind.FIXED),
    /** Bitwise AND with the referenced cell. */
    BWA(11000, Kind.BAND),
    /** Bitwise OR with the referenced cell. */
    BWO(12000, Kind.BAND),
    /** Bitwise XOR with the referenced cell. */
    BWX(13000, Kind.BAND),
    /** Data pseudo-instruction, never executed. */
    DAT(0, Kind.DATA);

    /**
     * How an opcode carries its operand.
     */
    public enum Kind {
        /** A single code with no operand. */
        FIXED,
        /** A base code plus an address operand. */
        BAND,
        /** Raw data, the operand is the cell value. */
        DATA
    }

    private static final Map<String, Opcode> BY_MNEMONIC = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(Opcode::name, Function.identity())));

    private final int code;
    private final Kind kind;

    Opcode(int code, Kind kind) {
        this.code = code;
        this.kind = kind;
    }

    /**
     * @return The fixed code, or the band base for operand-bearing opcodes.
     */
    public int code() {
        return code;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return {@code true} if the instruction requires an address operand.
     */
    public boolean takesAddress() {
        return kind == Kind.BAND;
    }

    /**
     * Looks up an opcode by its exact (upper-case) mnemonic.
     * @param mnemonic The mnemonic, e.g. {@code "ADD"}.
     * @return The opcode, or empty if the text is not a mnemonic.
     */
    public static Optional<Opcode> fromMnemonic(String mnemonic) {
        return Optional.ofNullable(BY_MNEMONIC.get(mnemonic));
    }
}
