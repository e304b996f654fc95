package org.littlemanplus.compiler.backend.link;

import org.littlemanplus.compiler.api.CompilerErrorCode;
import org.littlemanplus.compiler.diagnostics.DiagnosticsEngine;
import org.littlemanplus.compiler.frontend.lexer.Token;
import org.littlemanplus.compiler.frontend.parser.ast.InstructionNode;
import org.littlemanplus.compiler.frontend.parser.ast.OperandNode;
import org.littlemanplus.runtime.isa.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Linking pass: resolves symbolic operands into numbers.
 * <p>
 * The first pass records the address of every label, which is simply the index of its
 * line. The second pass rewrites each operand: a label reference becomes the label's
 * address and an {@code @label} pointer reference becomes that address plus the memory
 * capacity, the indirection marker understood by the virtual machine.
 */
public final class Linker {

    private final int memoryCapacity;
    private final DiagnosticsEngine diagnostics;
    private final Map<String, Integer> labelToAddress = new LinkedHashMap<>();

    /**
     * Constructs a new linker.
     * @param memoryCapacity The capacity added to pointer references.
     * @param diagnostics The engine for reporting unknown and duplicate labels.
     */
    public Linker(int memoryCapacity, DiagnosticsEngine diagnostics) {
        this.memoryCapacity = memoryCapacity;
        this.diagnostics = diagnostics;
    }

    /**
     * Links the parsed program.
     * @param nodes The instruction nodes in address order.
     * @return The resolved instructions. Operands that failed to resolve are left as {@code 0};
     *         the caller must check the diagnostics before using the result.
     */
    public List<Instruction> link(List<InstructionNode> nodes) {
        collectLabels(nodes);

        List<Instruction> out = new ArrayList<>(nodes.size());
        for (InstructionNode node : nodes) {
            long operand = node.operandNode().map(this::resolve).orElse(0L);
            out.add(Instruction.of(node.opcode(), operand));
        }
        return out;
    }

    /**
     * @return The label table built by the last {@link #link(List)} call, in definition order.
     */
    public Map<String, Integer> getLabels() {
        return Collections.unmodifiableMap(labelToAddress);
    }

    private void collectLabels(List<InstructionNode> nodes) {
        labelToAddress.clear();
        for (int address = 0; address < nodes.size(); address++) {
            Token label = nodes.get(address).label();
            if (label == null) {
                continue;
            }
            Integer previous = labelToAddress.putIfAbsent(label.text(), address);
            if (previous != null) {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_LABEL,
                        "Label '" + label.text() + "' is already defined at address " + previous + ".",
                        label.fileName(), label.line());
            }
        }
    }

    private long resolve(OperandNode operand) {
        if (operand instanceof OperandNode.NumberOperand number) {
            return number.value();
        }
        if (operand instanceof OperandNode.LabelRef ref) {
            return lookup(ref.name(), ref.token());
        }
        if (operand instanceof OperandNode.PointerRef ref) {
            return lookup(ref.name(), ref.token()) + memoryCapacity;
        }
        throw new IllegalStateException("Unhandled operand node: " + operand);
    }

    private long lookup(String name, Token token) {
        Integer address = labelToAddress.get(name);
        if (address == null) {
            diagnostics.reportError(CompilerErrorCode.LABEL_NOT_FOUND,
                    "Unknown label '" + name + "'.", token.fileName(), token.line());
            return 0L;
        }
        return address;
    }
}
