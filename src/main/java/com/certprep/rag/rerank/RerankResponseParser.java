package com.certprep.rag.rerank;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the judge's comma-separated index list.
 *
 * <p>Non-numeric and out-of-range tokens are dropped, as are repeats of an index
 * already seen. An unusable answer yields an empty list.
 */
public final class RerankResponseParser {

    private RerankResponseParser() {
    }

    public static List<Integer> parse(String response, int candidateCount) {
        if (response == null) {
            return List.of();
        }
        String body = stripMarkers(response);

        Set<Integer> indices = new LinkedHashSet<>();
        for (String token : body.split(",")) {
            try {
                int index = Integer.parseInt(token.trim());
                if (index >= 0 && index < candidateCount) {
                    indices.add(index);
                }
            } catch (NumberFormatException ignored) {
                // not an index, skip the token
            }
        }
        return new ArrayList<>(indices);
    }

    static String stripMarkers(String response) {
        String body = response;
        int open = body.indexOf(RerankPrompt.OPEN_MARKER);
        if (open >= 0) {
            body = body.substring(open + RerankPrompt.OPEN_MARKER.length());
        }
        int close = body.indexOf(RerankPrompt.CLOSE_MARKER);
        if (close >= 0) {
            body = body.substring(0, close);
        }
        return body.trim();
    }
}
