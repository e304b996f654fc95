package org.littlemanplus.runtime.model;

/**
 * The reasons for which the machine can enter its terminal fault state.
 */
public enum FaultReason {
    /** A branch target or data address lies outside {@code [0, capacity)}. */
    ADDRESS_OUT_OF_RANGE,
    /**
     * An operand, or a cell reached through a pointer, lies at or beyond {@code 2 * capacity}
     * and so is neither a direct address nor an indirection marker.
     */
    POINTER_OUT_OF_RANGE,
    /** A pointer chain exceeded the configured maximum depth, usually because it cycles. */
    INDIRECTION_TOO_DEEP,
    /** A fetched cell did not decode and the decode-failure policy is {@code FAULT}. */
    UNKNOWN_OPCODE
}
