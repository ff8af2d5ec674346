package com.keystone.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestration MDC keys for structured logging.
 * Worker threads do not inherit MDC, so each sets its own block context.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String BLOCK_ID = "blockId";
    public static final String BRANCH_ID = "branchId";
    public static final String LAYER = "layer";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setBlock(String runId, String blockId) {
        MDC.put(RUN_ID, runId);
        MDC.put(BLOCK_ID, blockId);
    }

    public static void setLayer(String runId, int layer) {
        MDC.put(RUN_ID, runId);
        MDC.put(LAYER, String.valueOf(layer));
    }

    public static void setBranch(String branchId) {
        MDC.put(BRANCH_ID, branchId);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(BLOCK_ID);
        MDC.remove(BRANCH_ID);
        MDC.remove(LAYER);
    }
}
