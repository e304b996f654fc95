package org.littlemanplus.runtime;

import org.littlemanplus.compiler.Assembler;
import org.littlemanplus.compiler.api.AssembledProgram;
import org.littlemanplus.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs a complete pointer-based bubble sort: ten values are read, sorted in place in
 * cells 90..99 and written out in ascending order.
 */
@ExtendWith(LogWatchExtension.class)
public class BubbleSortScenarioTest {

    private static final List<Long> UNSORTED = List.of(32L, 7L, 19L, 75L, 21L, 14L, 95L, 35L, 61L, 50L);
    private static final List<Long> SORTED = List.of(7L, 14L, 19L, 21L, 32L, 35L, 50L, 61L, 75L, 95L);

    private String source;

    @BeforeEach
    void loadSource() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/programs/bubble_sort.lmc")) {
            assertThat(in).isNotNull();
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @Tag("integration")
    void testSortsInputValues() throws Exception {
        VirtualMachine vm = new VirtualMachine();
        vm.compile(source, "bubble_sort.lmc");

        RunResult result = new ProgramRunner(VmOptions.defaults().maxCycles()).run(vm, InputProvider.of(UNSORTED));

        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.HALTED);
        assertThat(result.outputs()).containsExactlyElementsOf(SORTED);
        long[] memory = vm.getMemorySnapshot();
        for (int i = 0; i < SORTED.size(); i++) {
            assertThat(memory[90 + i]).isEqualTo(SORTED.get(i));
        }
    }

    @Test
    @Tag("integration")
    void testStepByStepMatchesRunner() throws Exception {
        VirtualMachine vm = new VirtualMachine();
        vm.compile(source);
        List<Long> remaining = new ArrayList<>(UNSORTED);
        List<Long> outputs = new ArrayList<>();

        StepResult result = vm.step();
        while (!result.isTerminal()) {
            if (result instanceof StepResult.InputRequired) {
                vm.input(remaining.remove(0));
            } else if (result instanceof StepResult.Output output) {
                outputs.add(output.value());
            }
            result = vm.step();
        }

        assertThat(result).isEqualTo(StepResult.HALTED);
        assertThat(remaining).isEmpty();
        assertThat(outputs).containsExactlyElementsOf(SORTED);
    }

    @Test
    @Tag("unit")
    void testProgramLeavesRoomForData() throws Exception {
        AssembledProgram program = new Assembler().assemble(source);

        assertThat(program.size()).isLessThanOrEqualTo(90);
        assertThat(program.labels()).containsEntry("init", 0);
    }
}
