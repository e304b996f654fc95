package org.littlemanplus.runtime;

import org.littlemanplus.compiler.Assembler;
import org.littlemanplus.compiler.api.AssembledProgram;
import org.littlemanplus.compiler.api.CompilationException;
import org.littlemanplus.runtime.isa.Instruction;
import org.littlemanplus.runtime.isa.InstructionCodec;
import org.littlemanplus.runtime.isa.Opcode;
import org.littlemanplus.runtime.isa.UnknownOpcodeException;
import org.littlemanplus.runtime.model.FaultReason;
import org.littlemanplus.runtime.model.MachineFaultException;
import org.littlemanplus.runtime.model.Memory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * The core of the execution environment: an accumulator machine with a flat memory of
 * {@link Config#MEMORY_CAPACITY} cells, executed one cycle per {@link #step()}.
 * <p>
 * Execution is driven entirely by the host. When an {@code INP} finds no buffered value the
 * machine reports {@link StepResult.InputRequired} and stays on that instruction until
 * {@link #input(long)} is called, so the host can keep doing other work in between.
 * Illegal operations by the program never throw; they end in a terminal
 * {@link StepResult.Fault}. This class is not thread-safe.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final VmOptions options;
    private final Assembler assembler = new Assembler();
    private final Memory memory = new Memory(Config.MEMORY_CAPACITY);

    private int programCounter;
    private long accumulator;
    private long cycles;
    private boolean inputPending;
    private long pendingInput;
    private int lastAccessedAddress = -1;
    private MachineState state = MachineState.RUNNING;
    private StepResult terminalResult;
    private AssembledProgram program;

    /**
     * Creates an empty machine with default options.
     */
    public VirtualMachine() {
        this(VmOptions.defaults());
    }

    /**
     * Creates an empty machine.
     * @param options The runtime options.
     */
    public VirtualMachine(VmOptions options) {
        this.options = options;
    }

    /**
     * Assembles the source and loads it, see {@link #load(AssembledProgram)}.
     *
     * @param source The assembly source.
     * @throws ProgramLoadException if the source does not assemble or does not fit into memory.
     */
    public void compile(String source) throws ProgramLoadException {
        compile(source, "<memory>");
    }

    /**
     * Assembles the source and loads it, see {@link #load(AssembledProgram)}.
     *
     * @param source The assembly source.
     * @param programName The program name used in diagnostics.
     * @throws ProgramLoadException if the source does not assemble or does not fit into memory.
     */
    public void compile(String source, String programName) throws ProgramLoadException {
        AssembledProgram assembled;
        try {
            assembled = assembler.assemble(source, programName);
        } catch (CompilationException e) {
            throw new ProgramLoadException(ProgramLoadException.Reason.COMPILE_FAILED,
                    "Could not compile the program:\n" + e.getMessage(), e);
        }
        load(assembled);
    }

    /**
     * Replaces memory with the program image and fully resets the registers.
     * On failure nothing is changed.
     *
     * @param assembled The program to load.
     * @throws ProgramLoadException if the program has more cells than the machine has memory.
     */
    public void load(AssembledProgram assembled) throws ProgramLoadException {
        if (assembled.size() > memory.capacity()) {
            throw new ProgramLoadException(ProgramLoadException.Reason.PROGRAM_TOO_LARGE,
                    "The program is " + assembled.size() + " cells long but memory holds only "
                            + memory.capacity() + " cells.");
        }
        long[] image = assembled.toMemoryImage();
        memory.clear();
        for (int address = 0; address < image.length; address++) {
            memory.load(address, image[address]);
        }
        this.program = assembled;
        resetRegisters();
        LOG.info("Loaded program '{}' ({} cells)", assembled.programName(), image.length);
    }

    /**
     * Executes exactly one cycle.
     *
     * @return The outcome of the cycle. Once a terminal result has been returned, every further
     *         call returns the same result without doing anything.
     */
    public StepResult step() {
        if (state.isTerminal()) {
            return terminalResult;
        }
        if (programCounter >= memory.capacity()) {
            cycles++;
            LOG.debug("Program counter ran past the end of memory after {} cycles", cycles);
            return halt();
        }

        int address = programCounter;
        try {
            // Fetch & decode
            lastAccessedAddress = address;
            long cell = memory.read(address);
            Instruction instruction;
            try {
                instruction = InstructionCodec.decode(cell);
            } catch (UnknownOpcodeException e) {
                cycles++;
                return undecodable(address, e);
            }

            if (instruction.opcode() == Opcode.INP && !inputPending) {
                state = MachineState.AWAITING_INPUT;
                return StepResult.INPUT_REQUIRED;
            }

            // Execute
            cycles++;
            return execute(instruction);
        } catch (MachineFaultException e) {
            return fault(e.getReason(), e.getMessage(), address);
        }
    }

    /**
     * Buffers one input value for the next {@code INP}, replacing any unconsumed value.
     * @param value The value to supply.
     */
    public void input(long value) {
        this.pendingInput = value;
        this.inputPending = true;
        if (state == MachineState.AWAITING_INPUT) {
            state = MachineState.RUNNING;
        }
    }

    /**
     * Rewinds a halted or faulted machine to the start of its program. Memory keeps its current
     * contents, including any cells the program modified. Has no effect while running.
     */
    public void reset() {
        if (!state.isTerminal()) {
            LOG.debug("Ignoring reset while {}", state);
            return;
        }
        resetRegisters();
    }

    private StepResult execute(Instruction instruction) throws MachineFaultException {
        long operand = instruction.operand();
        switch (instruction.opcode()) {
            case ADD:
                accumulator += readResolved(operand);
                break;
            case SUB:
                accumulator -= readResolved(operand);
                break;
            case STA:
                writeResolved(operand, accumulator);
                break;
            case LDA:
                accumulator = readResolved(operand);
                break;
            case LDR:
                accumulator = readResolved(accumulator);
                break;
            case BRA:
                return branch(operand);
            case BRZ:
                if (accumulator == 0) {
                    return branch(operand);
                }
                break;
            case BRP:
                if (accumulator >= 0) {
                    return branch(operand);
                }
                break;
            case BWN:
                accumulator = ~accumulator;
                break;
            case BWA:
                accumulator &= readResolved(operand);
                break;
            case BWO:
                accumulator |= readResolved(operand);
                break;
            case BWX:
                accumulator ^= readResolved(operand);
                break;
            case INP:
                accumulator = pendingInput;
                inputPending = false;
                break;
            case OUT:
                programCounter++;
                return new StepResult.Output(accumulator);
            case HLT:
                LOG.debug("Program halted after {} cycles", cycles);
                return halt();
            default:
                throw new IllegalStateException("Opcode cannot be executed: " + instruction.opcode());
        }
        programCounter++;
        return StepResult.ADVANCED;
    }

    /**
     * Jumps to a direct address. Branch operands are never followed as pointers, so any
     * target outside memory faults.
     */
    private StepResult branch(long target) throws MachineFaultException {
        if (target < 0 || target >= memory.capacity()) {
            throw new MachineFaultException(FaultReason.ADDRESS_OUT_OF_RANGE,
                    "Branch target " + target + " outside memory [0, " + memory.capacity() + ")");
        }
        programCounter = (int) target;
        return StepResult.ADVANCED;
    }

    private long readResolved(long operand) throws MachineFaultException {
        int address = memory.resolve(operand, options.maxIndirectionDepth());
        lastAccessedAddress = address;
        return memory.read(address);
    }

    private void writeResolved(long operand, long value) throws MachineFaultException {
        int address = memory.resolve(operand, options.maxIndirectionDepth());
        lastAccessedAddress = address;
        memory.write(address, value);
    }

    private StepResult undecodable(int address, UnknownOpcodeException e) {
        if (options.decodeFailurePolicy() == VmOptions.DecodeFailurePolicy.FAULT) {
            return fault(FaultReason.UNKNOWN_OPCODE, e.getMessage() + " at address " + address, address);
        }
        LOG.debug("Skipping undecodable cell {} at address {}", e.getValue(), address);
        programCounter++;
        return StepResult.ADVANCED;
    }

    private StepResult halt() {
        state = MachineState.HALTED;
        terminalResult = StepResult.HALTED;
        return terminalResult;
    }

    private StepResult fault(FaultReason reason, String message, int address) {
        state = MachineState.FAULTED;
        terminalResult = new StepResult.Fault(reason, message, address);
        LOG.info("Machine faulted at address {} ({}): {}", address, reason, message);
        return terminalResult;
    }

    private void resetRegisters() {
        programCounter = 0;
        accumulator = 0;
        cycles = 0;
        inputPending = false;
        pendingInput = 0;
        lastAccessedAddress = -1;
        state = MachineState.RUNNING;
        terminalResult = null;
    }

    public int getProgramCounter() {
        return programCounter;
    }

    public long getAccumulator() {
        return accumulator;
    }

    /**
     * @return The number of executed cycles since the last load or reset. Suspended
     *         {@code INP} cycles are not counted.
     */
    public long getCycles() {
        return cycles;
    }

    /**
     * @return {@code true} once the machine has stopped, by {@code HLT}, by running off the end
     *         of memory or by a fault.
     */
    public boolean isHalted() {
        return state.isTerminal();
    }

    public MachineState getState() {
        return state;
    }

    /**
     * @return The fault that stopped the machine, if it is in {@link MachineState#FAULTED}.
     */
    public Optional<StepResult.Fault> getFault() {
        return terminalResult instanceof StepResult.Fault fault ? Optional.of(fault) : Optional.empty();
    }

    /**
     * @return The value waiting for the next {@code INP}, if any.
     */
    public OptionalLong getPendingInput() {
        return inputPending ? OptionalLong.of(pendingInput) : OptionalLong.empty();
    }

    /**
     * @return The address last fetched, read or written, or {@code -1} if none since the last load.
     */
    public int getLastAccessedAddress() {
        return lastAccessedAddress;
    }

    /**
     * @return A copy of the whole memory.
     */
    public long[] getMemorySnapshot() {
        return memory.snapshot();
    }

    public int getMemoryCapacity() {
        return memory.capacity();
    }

    /**
     * @return The program loaded last, for mapping addresses back to source lines.
     */
    public Optional<AssembledProgram> getProgram() {
        return Optional.ofNullable(program);
    }

    public VmOptions getOptions() {
        return options;
    }
}
