package org.littlemanplus.compiler.api;

import org.littlemanplus.runtime.isa.Instruction;
import org.littlemanplus.runtime.isa.InstructionCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The immutable result of a successful assembly run.
 *
 * @param programName The logical name of the program.
 * @param instructions The resolved instructions; the index of each is its memory address.
 * @param labels The label table, label name to address, in definition order.
 * @param sourceMap The source line of every instruction, index-aligned with {@code instructions}.
 */
public record AssembledProgram(
        String programName,
        List<Instruction> instructions,
        Map<String, Integer> labels,
        List<SourceInfo> sourceMap
) {

    public AssembledProgram {
        Objects.requireNonNull(programName, "programName");
        instructions = List.copyOf(instructions);
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        sourceMap = List.copyOf(sourceMap);
        if (instructions.size() != sourceMap.size()) {
            throw new IllegalArgumentException("Source map must have one entry per instruction");
        }
    }

    /**
     * @return The number of memory cells the program occupies.
     */
    public int size() {
        return instructions.size();
    }

    /**
     * Encodes every instruction into its cell value.
     * @return The memory image, one cell per instruction.
     */
    public long[] toMemoryImage() {
        long[] image = new long[instructions.size()];
        for (int address = 0; address < image.length; address++) {
            image[address] = InstructionCodec.encode(instructions.get(address));
        }
        return image;
    }

    /**
     * @param address A memory address.
     * @return The source line the cell at the address was assembled from.
     */
    public Optional<SourceInfo> sourceAt(int address) {
        if (address < 0 || address >= sourceMap.size()) {
            return Optional.empty();
        }
        return Optional.of(sourceMap.get(address));
    }
}
