package org.littlemanplus.runtime.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for cell access and pointer resolution in {@link Memory}.
 */
public class MemoryTest {

    private static final int CAPACITY = 100;
    private Memory memory;

    @BeforeEach
    void setUp() {
        memory = new Memory(CAPACITY);
    }

    @Test
    @Tag("unit")
    void testDirectAddressResolvesToItself() throws MachineFaultException {
        assertThat(memory.resolve(0, 32)).isZero();
        assertThat(memory.resolve(99, 32)).isEqualTo(99);
    }

    @Test
    @Tag("unit")
    void testSingleIndirection() throws MachineFaultException {
        memory.load(5, 42);

        assertThat(memory.resolve(105, 32)).isEqualTo(42);
    }

    /**
     * A marker for cell 0 is 100, the smallest marker there is.
     */
    @Test
    @Tag("unit")
    void testIndirectionThroughCellZero() throws MachineFaultException {
        memory.load(0, 17);

        assertThat(memory.resolve(100, 32)).isEqualTo(17);
    }

    @Test
    @Tag("unit")
    void testChainOfExactlyMaxDepthResolves() throws MachineFaultException {
        // 110 -> cell 10 holds 111 -> cell 11 holds 112 -> cell 12 holds 50
        memory.load(10, 111);
        memory.load(11, 112);
        memory.load(12, 50);

        assertThat(memory.resolve(110, 3)).isEqualTo(50);
        assertThatThrownBy(() -> memory.resolve(110, 2))
                .isInstanceOf(MachineFaultException.class)
                .extracting(e -> ((MachineFaultException) e).getReason())
                .isEqualTo(FaultReason.INDIRECTION_TOO_DEEP);
    }

    @Test
    @Tag("unit")
    void testDepthZeroAllowsOnlyDirectAddresses() throws MachineFaultException {
        assertThat(memory.resolve(7, 0)).isEqualTo(7);
        assertThatThrownBy(() -> memory.resolve(107, 0))
                .extracting(e -> ((MachineFaultException) e).getReason())
                .isEqualTo(FaultReason.INDIRECTION_TOO_DEEP);
    }

    @Test
    @Tag("unit")
    void testPointerCycleFaults() {
        memory.load(3, 103);

        assertThatThrownBy(() -> memory.resolve(103, 32))
                .extracting(e -> ((MachineFaultException) e).getReason())
                .isEqualTo(FaultReason.INDIRECTION_TOO_DEEP);
    }

    @Test
    @Tag("unit")
    void testOperandOutOfRange() {
        assertThatThrownBy(() -> memory.resolve(200, 32))
                .extracting(e -> ((MachineFaultException) e).getReason())
                .isEqualTo(FaultReason.POINTER_OUT_OF_RANGE);
        assertThatThrownBy(() -> memory.resolve(-1, 32))
                .extracting(e -> ((MachineFaultException) e).getReason())
                .isEqualTo(FaultReason.ADDRESS_OUT_OF_RANGE);
    }

    @Test
    @Tag("unit")
    void testFollowedCellOutOfRange() {
        memory.load(4, 250);

        assertThatThrownBy(() -> memory.resolve(104, 32))
                .extracting(e -> ((MachineFaultException) e).getReason())
                .isEqualTo(FaultReason.POINTER_OUT_OF_RANGE);
    }

    @Test
    @Tag("unit")
    void testReadWriteAndBounds() throws MachineFaultException {
        memory.write(42, -7);

        assertThat(memory.read(42)).isEqualTo(-7);
        assertThatThrownBy(() -> memory.read(100)).isInstanceOf(MachineFaultException.class);
        assertThatThrownBy(() -> memory.write(-1, 0)).isInstanceOf(MachineFaultException.class);
        assertThatThrownBy(() -> memory.load(100, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void testSnapshotIsACopyAndClearZeroes() throws MachineFaultException {
        memory.write(1, 9);
        long[] snapshot = memory.snapshot();
        snapshot[1] = 0;

        assertThat(memory.read(1)).isEqualTo(9);
        memory.clear();
        assertThat(memory.snapshot()).containsOnly(0L).hasSize(CAPACITY);
    }
}
