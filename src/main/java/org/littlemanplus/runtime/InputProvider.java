package org.littlemanplus.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;

/**
 * Supplies values to a program that executes {@code INP}.
 */
@FunctionalInterface
public interface InputProvider {

    /**
     * @return The next input value, or empty if none is available right now.
     */
    OptionalLong next();

    /**
     * @return A provider that never has input.
     */
    static InputProvider none() {
        return OptionalLong::empty;
    }

    /**
     * @param values The values to serve, in order.
     * @return A provider that serves the values once each and is then exhausted.
     */
    static InputProvider of(List<Long> values) {
        Deque<Long> queue = new ArrayDeque<>(values);
        return () -> queue.isEmpty() ? OptionalLong.empty() : OptionalLong.of(queue.poll());
    }
}
