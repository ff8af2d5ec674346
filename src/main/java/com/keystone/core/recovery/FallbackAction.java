package com.keystone.core.recovery;

import java.util.Objects;

/**
 * Terminal recovery behavior applied once retries are exhausted.
 *
 * @param type        the action
 * @param alternateId name of the alternative operation for {@link FallbackType#USE_ALTERNATE}, null otherwise
 */
public record FallbackAction(FallbackType type, String alternateId) {

    public FallbackAction {
        Objects.requireNonNull(type, "type");
        if (type == FallbackType.USE_ALTERNATE && (alternateId == null || alternateId.isBlank())) {
            throw new IllegalArgumentException("USE_ALTERNATE requires an alternate id");
        }
    }

    public static FallbackAction skip() { return new FallbackAction(FallbackType.SKIP, null); }
    public static FallbackAction simplify() { return new FallbackAction(FallbackType.SIMPLIFY, null); }
    public static FallbackAction revert() { return new FallbackAction(FallbackType.REVERT, null); }
    public static FallbackAction subdivide() { return new FallbackAction(FallbackType.SUBDIVIDE, null); }
    public static FallbackAction abort() { return new FallbackAction(FallbackType.ABORT, null); }

    public static FallbackAction useAlternate(String alternateId) {
        return new FallbackAction(FallbackType.USE_ALTERNATE, alternateId);
    }

    @Override
    public String toString() {
        return type == FallbackType.USE_ALTERNATE ? type + "(" + alternateId + ")" : type.name();
    }
}
