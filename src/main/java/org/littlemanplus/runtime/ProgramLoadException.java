package org.littlemanplus.runtime;

/**
 * Thrown when a program cannot be loaded into the virtual machine. Memory is left untouched.
 */
public class ProgramLoadException extends Exception {

    /**
     * Why the load failed.
     */
    public enum Reason {
        /** The source did not assemble; the cause is the {@code CompilationException}. */
        COMPILE_FAILED,
        /** The program has more cells than the machine has mailboxes. */
        PROGRAM_TOO_LARGE
    }

    private final Reason reason;

    /**
     * @param reason Why the load failed.
     * @param message The detail message.
     */
    public ProgramLoadException(Reason reason, String message) {
        this(reason, message, null);
    }

    /**
     * @param reason Why the load failed.
     * @param message The detail message.
     * @param cause The underlying exception.
     */
    public ProgramLoadException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
