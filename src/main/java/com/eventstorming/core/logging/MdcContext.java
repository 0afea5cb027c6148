package com.eventstorming.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing workshop-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkshop(String workshopId) {
        if (workshopId != null) {
            MDC.put("workshopId", workshopId);
        }
    }

    public static void setOperation(String workshopId, String operation) {
        setWorkshop(workshopId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("workshopId");
        MDC.remove("operation");
    }
}
