package com.certprep.rag.util;

import com.certprep.rag.model.CallContext;
import com.certprep.rag.model.ServiceType;
import org.slf4j.Logger;

import java.util.List;

/**
 * Structured logging helpers for calls to the vector store, embedding and judge providers.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Shortens long prompts and passages for log output.
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
     * Renders the head of a vector, e.g. {@code [0.12, -0.3, 0.05, ...(1536)]}.
     */
    public static String previewVector(List<Float> vector) {
        if (vector == null) {
            return "(null)";
        }
        int shown = Math.min(3, vector.size());
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < shown; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(vector.get(i));
        }
        if (vector.size() > shown) {
            sb.append(", ...(").append(vector.size()).append(')');
        }
        return sb.append(']').toString();
    }
}
