package com.keystone.core.scheduler;

import com.keystone.core.model.BlockStatus;

/**
 * Validates block status transitions.
 *
 * <p><strong>Allowed transitions:</strong></p>
 * <ul>
 *   <li>NOT_STARTED → READY | BLOCKED</li>
 *   <li>READY → IN_PROGRESS | BLOCKED</li>
 *   <li>IN_PROGRESS → COMPLETED | COMPLETED_WITH_ISSUES | FAILED</li>
 *   <li>FAILED → IN_PROGRESS (retry) | DEFERRED</li>
 *   <li>BLOCKED → READY | DEFERRED</li>
 * </ul>
 * COMPLETED, COMPLETED_WITH_ISSUES and DEFERRED are terminal.
 */
public final class BlockTransitions {

    private BlockTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isAllowed(BlockStatus from, BlockStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case NOT_STARTED -> to == BlockStatus.READY || to == BlockStatus.BLOCKED;
            case READY -> to == BlockStatus.IN_PROGRESS || to == BlockStatus.BLOCKED;
            case IN_PROGRESS -> to == BlockStatus.COMPLETED || to == BlockStatus.COMPLETED_WITH_ISSUES
                    || to == BlockStatus.FAILED;
            case FAILED -> to == BlockStatus.IN_PROGRESS || to == BlockStatus.DEFERRED;
            case BLOCKED -> to == BlockStatus.READY || to == BlockStatus.DEFERRED;
            case COMPLETED, COMPLETED_WITH_ISSUES, DEFERRED -> false;
        };
    }

    /**
     * @throws IllegalArgumentException if either status is null
     * @throws IllegalStateException    if the transition is not allowed
     */
    public static void validate(String blockId, BlockStatus from, BlockStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                    String.format("Invalid transition for block %s: %s → %s", blockId, from, to));
        }
    }
}
