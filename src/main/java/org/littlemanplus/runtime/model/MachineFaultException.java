package org.littlemanplus.runtime.model;

/**
 * Raised inside a machine cycle when the running program does something illegal.
 * The virtual machine catches it and turns it into a terminal fault result; it never
 * reaches the host.
 */
public class MachineFaultException extends Exception {

    private final FaultReason reason;

    /**
     * @param reason The classification of the fault.
     * @param message A human readable description including the offending value.
     */
    public MachineFaultException(FaultReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FaultReason getReason() {
        return reason;
    }
}
