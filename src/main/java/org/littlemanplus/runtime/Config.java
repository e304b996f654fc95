package org.littlemanplus.runtime;

/**
 * Provides the fixed machine constants shared by the assembler and the virtual machine.
 * This final class contains static constants only and is not meant to be instantiated.
 * Tunable runtime behaviour lives in {@link VmOptions} and is loaded from HOCON.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The number of mailboxes (memory cells) of the machine. A program may not be longer
     * than this. Operands in {@code [MEMORY_CAPACITY, 2 * MEMORY_CAPACITY)} are indirection
     * markers.
     */
    public static final int MEMORY_CAPACITY = 100;

    /**
     * The width of every opcode band in the instruction encoding. Operands must be
     * strictly smaller than this value.
     */
    public static final int BAND_WIDTH = 1000;

    /**
     * The default number of pointer hops followed before a resolution is aborted.
     */
    public static final int DEFAULT_MAX_INDIRECTION_DEPTH = 32;

    /**
     * The default number of cycles the {@link ProgramRunner} executes before giving up.
     */
    public static final long DEFAULT_MAX_CYCLES = 1_000_000L;

    static {
        if (2 * MEMORY_CAPACITY > BAND_WIDTH) {
            throw new ExceptionInInitializerError("Pointer operands must fit into one band");
        }
    }
}
