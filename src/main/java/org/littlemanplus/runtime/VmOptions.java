package org.littlemanplus.runtime;

import com.typesafe.config.ConfigException;

import java.util.Locale;

/**
 * Tunable behaviour of the {@link VirtualMachine} and {@link ProgramRunner}.
 *
 * @param maxIndirectionDepth The maximum number of pointer hops followed while resolving an operand.
 * @param decodeFailurePolicy What a cycle does with a cell that does not decode.
 * @param maxCycles The number of cycles after which {@link ProgramRunner} stops.
 */
public record VmOptions(int maxIndirectionDepth, DecodeFailurePolicy decodeFailurePolicy, long maxCycles) {

    private static final String VM_PATH = "littleman.vm";
    private static final String RUNNER_PATH = "littleman.runner";

    /**
     * How a fetched cell that matches no opcode is handled.
     */
    public enum DecodeFailurePolicy {
        /** Skip the cell: the program counter advances and the cycle reports {@code Advanced}. */
        SKIP,
        /** Stop the machine with an {@code UNKNOWN_OPCODE} fault. */
        FAULT
    }

    public VmOptions {
        if (maxIndirectionDepth < 0) {
            throw new IllegalArgumentException("max-indirection-depth must not be negative, got " + maxIndirectionDepth);
        }
        if (decodeFailurePolicy == null) {
            throw new IllegalArgumentException("decode-failure-policy must be set");
        }
        if (maxCycles <= 0) {
            throw new IllegalArgumentException("max-cycles must be positive, got " + maxCycles);
        }
    }

    /**
     * @return The built-in defaults, identical to {@code reference.conf}.
     */
    public static VmOptions defaults() {
        return new VmOptions(Config.DEFAULT_MAX_INDIRECTION_DEPTH, DecodeFailurePolicy.SKIP, Config.DEFAULT_MAX_CYCLES);
    }

    /**
     * Reads the options from the {@code littleman} section of a HOCON configuration.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The resolved application configuration.
     * @return The options.
     * @throws IllegalArgumentException if a value is malformed.
     */
    public static VmOptions fromConfig(com.typesafe.config.Config config) {
        VmOptions defaults = defaults();
        try {
            int depth = config.hasPath(VM_PATH + ".max-indirection-depth")
                    ? config.getInt(VM_PATH + ".max-indirection-depth")
                    : defaults.maxIndirectionDepth();
            DecodeFailurePolicy policy = config.hasPath(VM_PATH + ".decode-failure-policy")
                    ? parsePolicy(config.getString(VM_PATH + ".decode-failure-policy"))
                    : defaults.decodeFailurePolicy();
            long cycles = config.hasPath(RUNNER_PATH + ".max-cycles")
                    ? config.getLong(RUNNER_PATH + ".max-cycles")
                    : defaults.maxCycles();
            return new VmOptions(depth, policy, cycles);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid virtual machine configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @param maxCycles The new cycle limit.
     * @return A copy with a different cycle limit.
     */
    public VmOptions withMaxCycles(long maxCycles) {
        return new VmOptions(maxIndirectionDepth, decodeFailurePolicy, maxCycles);
    }

    private static DecodeFailurePolicy parsePolicy(String value) {
        try {
            return DecodeFailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown decode-failure-policy '" + value + "', expected SKIP or FAULT", e);
        }
    }
}
