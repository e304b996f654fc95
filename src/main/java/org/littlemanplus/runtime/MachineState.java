package org.littlemanplus.runtime;

/**
 * The execution state of the {@link VirtualMachine}.
 */
public enum MachineState {
    /** Ready to execute the next cycle. */
    RUNNING,
    /** Stopped at an {@code INP} until a value is supplied. */
    AWAITING_INPUT,
    /** Terminal: {@code HLT} executed or the program ran off the end of memory. */
    HALTED,
    /** Terminal: a runtime fault stopped the program. */
    FAULTED;

    /**
     * @return {@code true} for {@link #HALTED} and {@link #FAULTED}.
     */
    public boolean isTerminal() {
        return this == HALTED || this == FAULTED;
    }
}
