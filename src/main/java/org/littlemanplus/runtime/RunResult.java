package org.littlemanplus.runtime;

import java.util.List;

/**
 * The outcome of {@link ProgramRunner#run(VirtualMachine, InputProvider)}.
 *
 * @param outcome Why the run stopped.
 * @param outputs Every value the program output, in order.
 * @param lastStep The result of the last executed step.
 * @param cycles The machine's cycle counter when the run stopped.
 */
public record RunResult(Outcome outcome, List<Long> outputs, StepResult lastStep, long cycles) {

    /**
     * Why a run stopped.
     */
    public enum Outcome {
        /** The program halted normally. */
        HALTED,
        /** The program faulted. */
        FAULTED,
        /** The program asked for input the provider could not give. The machine can be resumed. */
        AWAITING_INPUT,
        /** The cycle limit was reached. The machine can be resumed. */
        CYCLE_LIMIT
    }

    public RunResult {
        outputs = List.copyOf(outputs);
    }
}
