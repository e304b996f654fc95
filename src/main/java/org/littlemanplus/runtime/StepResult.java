package org.littlemanplus.runtime;

import org.littlemanplus.runtime.model.FaultReason;

import java.util.Objects;

/**
 * The outcome of a single {@link VirtualMachine#step()}.
 */
public sealed interface StepResult permits StepResult.Advanced, StepResult.Output, StepResult.InputRequired,
        StepResult.Halted, StepResult.Fault {

    /** Shared instance for an ordinary executed cycle. */
    StepResult ADVANCED = new Advanced();
    /** Shared instance for a suspended {@code INP}. */
    StepResult INPUT_REQUIRED = new InputRequired();
    /** Shared instance for the halted machine. */
    StepResult HALTED = new Halted();

    /**
     * @return {@code true} if no further step can change the machine.
     */
    default boolean isTerminal() {
        return false;
    }

    /**
     * An instruction was executed and the program counter moved on.
     */
    record Advanced() implements StepResult {}

    /**
     * An {@code OUT} was executed.
     * @param value The accumulator at the time of output.
     */
    record Output(long value) implements StepResult {}

    /**
     * An {@code INP} is waiting for {@link VirtualMachine#input(long)}; the program counter did not move.
     */
    record InputRequired() implements StepResult {}

    /**
     * The program executed {@code HLT} or ran past the end of memory.
     */
    record Halted() implements StepResult {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * The program did something illegal; the machine stopped.
     * @param reason The fault classification.
     * @param message A description including the offending value.
     * @param address The program counter of the faulting instruction.
     */
    record Fault(FaultReason reason, String message, int address) implements StepResult {
        public Fault {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
