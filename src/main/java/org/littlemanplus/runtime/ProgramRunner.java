package org.littlemanplus.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.LongConsumer;

/**
 * Drives a {@link VirtualMachine} step by step on behalf of a host that has nothing else to do
 * in between. Input is requested from an {@link InputProvider} whenever the program needs it.
 */
public class ProgramRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramRunner.class);

    private final long maxCycles;
    private final LongConsumer outputListener;

    /**
     * @param maxCycles The maximum number of steps a single run executes.
     */
    public ProgramRunner(long maxCycles) {
        this(maxCycles, value -> { });
    }

    /**
     * @param maxCycles The maximum number of steps a single run executes.
     * @param outputListener Called with every output value as soon as it is produced.
     */
    public ProgramRunner(long maxCycles, LongConsumer outputListener) {
        if (maxCycles <= 0) {
            throw new IllegalArgumentException("maxCycles must be positive, got " + maxCycles);
        }
        this.maxCycles = maxCycles;
        this.outputListener = outputListener;
    }

    /**
     * Steps the machine until it halts, faults, needs input the provider cannot give, or the
     * cycle limit is reached.
     *
     * @param vm A machine with a loaded program.
     * @param inputs The source of input values.
     * @return What happened.
     */
    public RunResult run(VirtualMachine vm, InputProvider inputs) {
        List<Long> outputs = new ArrayList<>();
        StepResult last = null;
        for (long step = 0; step < maxCycles; step++) {
            last = vm.step();
            if (last instanceof StepResult.Output output) {
                outputs.add(output.value());
                outputListener.accept(output.value());
            } else if (last instanceof StepResult.InputRequired) {
                OptionalLong value = inputs.next();
                if (value.isEmpty()) {
                    return finish(RunResult.Outcome.AWAITING_INPUT, outputs, last, vm);
                }
                vm.input(value.getAsLong());
            } else if (last instanceof StepResult.Halted) {
                return finish(RunResult.Outcome.HALTED, outputs, last, vm);
            } else if (last instanceof StepResult.Fault) {
                return finish(RunResult.Outcome.FAULTED, outputs, last, vm);
            }
        }
        LOG.warn("Program stopped after reaching the limit of {} cycles", maxCycles);
        return finish(RunResult.Outcome.CYCLE_LIMIT, outputs, last, vm);
    }

    private RunResult finish(RunResult.Outcome outcome, List<Long> outputs, StepResult last, VirtualMachine vm) {
        LOG.info("Run finished: {} after {} cycles with {} outputs", outcome, vm.getCycles(), outputs.size());
        return new RunResult(outcome, outputs, last, vm.getCycles());
    }
}
