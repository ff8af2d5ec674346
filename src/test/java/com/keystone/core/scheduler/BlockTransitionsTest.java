package com.keystone.core.scheduler;

import com.keystone.core.model.BlockStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class BlockTransitionsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "NOT_STARTED, READY",
            "NOT_STARTED, BLOCKED",
            "READY, IN_PROGRESS",
            "READY, BLOCKED",
            "IN_PROGRESS, COMPLETED",
            "IN_PROGRESS, COMPLETED_WITH_ISSUES",
            "IN_PROGRESS, FAILED",
            "FAILED, IN_PROGRESS",
            "FAILED, DEFERRED",
            "BLOCKED, READY",
            "BLOCKED, DEFERRED"
    })
    @DisplayName("Allowed transitions")
    void allowed(BlockStatus from, BlockStatus to) {
        assertTrue(BlockTransitions.isAllowed(from, to));
        assertDoesNotThrow(() -> BlockTransitions.validate("A", from, to));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "NOT_STARTED, IN_PROGRESS",
            "NOT_STARTED, COMPLETED",
            "READY, COMPLETED",
            "IN_PROGRESS, READY",
            "IN_PROGRESS, DEFERRED",
            "BLOCKED, IN_PROGRESS",
            "FAILED, COMPLETED"
    })
    @DisplayName("Disallowed transitions")
    void disallowed(BlockStatus from, BlockStatus to) {
        assertFalse(BlockTransitions.isAllowed(from, to));
        var ex = assertThrows(IllegalStateException.class, () -> BlockTransitions.validate("A", from, to));
        assertTrue(ex.getMessage().contains("block A"));
    }

    @ParameterizedTest
    @EnumSource(value = BlockStatus.class, names = {"COMPLETED", "COMPLETED_WITH_ISSUES", "DEFERRED"})
    @DisplayName("Terminal statuses allow no transition")
    void terminal(BlockStatus terminal) {
        for (BlockStatus to : BlockStatus.values()) {
            assertFalse(BlockTransitions.isAllowed(terminal, to), terminal + " -> " + to);
        }
    }

    @Test
    @DisplayName("Null statuses are rejected")
    void nullStatus() {
        assertFalse(BlockTransitions.isAllowed(null, BlockStatus.READY));
        assertThrows(IllegalArgumentException.class,
                () -> BlockTransitions.validate("A", BlockStatus.READY, null));
    }
}
