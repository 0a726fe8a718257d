package com.fleetmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing fleet-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String WORKER_ID = "workerId";
    public static final String TASK_ID = "taskId";
    public static final String TICK = "tick";

    private MdcContext() {}

    public static void setTick(long tick) {
        MDC.put(TICK, String.valueOf(tick));
    }

    public static void setWorker(String workerId) {
        MDC.put(WORKER_ID, workerId);
        MDC.remove(TASK_ID);
    }

    public static void setTask(String workerId, String taskId) {
        MDC.put(WORKER_ID, workerId);
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
    }

    public static void clearWorker() {
        MDC.remove(WORKER_ID);
        MDC.remove(TASK_ID);
    }

    public static void clear() {
        MDC.remove(WORKER_ID);
        MDC.remove(TASK_ID);
        MDC.remove(TICK);
    }
}
