package org.littlemanplus.runtime.model;

import java.util.Arrays;

/**
 * The mailboxes of the machine: a fixed number of signed 64-bit cells holding code and
 * data alike.
 * <p>
 * Addresses {@code 0..capacity-1} are direct. An operand {@code capacity + k} is an
 * indirection marker meaning "the real address is stored in cell {@code k}"; the stored
 * value may itself be a marker and is followed until a direct address is reached.
 */
public class Memory {

    private final long[] cells;

    /**
     * Creates a zero-filled memory.
     * @param capacity The number of cells.
     */
    public Memory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Memory capacity must be positive, got " + capacity);
        }
        this.cells = new long[capacity];
    }

    public int capacity() {
        return cells.length;
    }

    /**
     * Resets every cell to zero.
     */
    public void clear() {
        Arrays.fill(cells, 0L);
    }

    /**
     * Reads a cell.
     * @param address A direct address.
     * @return The cell value.
     * @throws MachineFaultException if the address lies outside memory.
     */
    public long read(long address) throws MachineFaultException {
        return cells[checkAddress(address)];
    }

    /**
     * Writes a cell.
     * @param address A direct address.
     * @param value The new cell value.
     * @throws MachineFaultException if the address lies outside memory.
     */
    public void write(long address, long value) throws MachineFaultException {
        cells[checkAddress(address)] = value;
    }

    /**
     * Writes a cell while a program image is being loaded.
     * @param address A direct address.
     * @param value The cell value.
     * @throws IllegalArgumentException if the address lies outside memory.
     */
    public void load(int address, long value) {
        if (address < 0 || address >= cells.length) {
            throw new IllegalArgumentException("Load address " + address + " outside memory [0, " + cells.length + ")");
        }
        cells[address] = value;
    }

    /**
     * Follows indirection markers until a direct address is reached.
     *
     * @param operand A direct address or an indirection marker.
     * @param maxDepth The maximum number of markers that may be followed.
     * @return The direct address the operand designates.
     * @throws MachineFaultException with {@link FaultReason#ADDRESS_OUT_OF_RANGE} for a negative
     *         operand, {@link FaultReason#POINTER_OUT_OF_RANGE} for an operand of at least
     *         {@code 2 * capacity} or a followed cell holding a value outside {@code [0, 2 * capacity)}, or
     *         {@link FaultReason#INDIRECTION_TOO_DEEP} when the chain is longer than {@code maxDepth}.
     */
    public int resolve(long operand, int maxDepth) throws MachineFaultException {
        long current = operand;
        int hops = 0;
        while (true) {
            if (hops == 0 && current < 0) {
                throw new MachineFaultException(FaultReason.ADDRESS_OUT_OF_RANGE,
                        "Address " + operand + " is negative");
            }
            if (current < 0 || current >= 2L * cells.length) {
                throw new MachineFaultException(FaultReason.POINTER_OUT_OF_RANGE, hops == 0
                        ? "Operand " + operand + " lies beyond the pointer range [" + cells.length + ", " + 2L * cells.length + ")"
                        : "Pointer chain starting at " + operand + " reached invalid value " + current);
            }
            if (current < cells.length) {
                return (int) current;
            }
            if (hops == maxDepth) {
                throw new MachineFaultException(FaultReason.INDIRECTION_TOO_DEEP,
                        "Pointer chain starting at " + operand + " exceeds " + maxDepth + " hops");
            }
            hops++;
            current = cells[(int) (current - cells.length)];
        }
    }

    /**
     * @return A copy of all cells, for display.
     */
    public long[] snapshot() {
        return cells.clone();
    }

    private int checkAddress(long address) throws MachineFaultException {
        if (address < 0 || address >= cells.length) {
            throw new MachineFaultException(FaultReason.ADDRESS_OUT_OF_RANGE,
                    "Address " + address + " outside memory [0, " + cells.length + ")");
        }
        return (int) address;
    }
}
