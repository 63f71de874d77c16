package com.purchasingpower.storyflow.util;

import com.purchasingpower.storyflow.model.CallContext;
import com.purchasingpower.storyflow.model.ServiceType;
import org.slf4j.Logger;

/**
 * Logging helpers for calls to the language model.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (stories are thousands of words).
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Whitespace-separated word count, as used for target word counts.
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
