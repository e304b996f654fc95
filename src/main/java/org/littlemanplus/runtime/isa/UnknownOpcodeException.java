package org.littlemanplus.runtime.isa;

/**
 * Thrown when a memory cell value does not fall into any fixed code or opcode band.
 */
public class UnknownOpcodeException extends Exception {

    private final long value;

    /**
     * @param value The cell value that could not be decoded.
     */
    public UnknownOpcodeException(long value) {
        super("Unknown opcode: " + value);
        this.value = value;
    }

    public long getValue() {
        return value;
    }
}
