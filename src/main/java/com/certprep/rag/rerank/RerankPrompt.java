package com.certprep.rag.rerank;

import com.certprep.rag.core.SearchResult;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Judgment prompt listing candidates by header and summary only, which keeps the
 * request small regardless of passage length.
 */
public final class RerankPrompt {

    public static final String OPEN_MARKER = "<relevant_indices>";
    public static final String CLOSE_MARKER = "</relevant_indices>";

    private RerankPrompt() {
    }

    public static String build(String queryText, List<SearchResult> candidates, int k) {
        String documents = IntStream.range(0, candidates.size())
                .mapToObj(i -> enumerate(i, candidates.get(i)))
                .collect(Collectors.joining("\n\n"));

        return "Query: " + queryText + "\n\n"
                + "You are given " + candidates.size() + " study passages, each labelled with an index [0-"
                + (candidates.size() - 1) + "].\n\n"
                + "Select the " + k + " passages that would best help answer the query. Prefer passages that "
                + "address the topic directly and add information the others do not.\n\n"
                + "<documents>\n" + documents + "\n</documents>\n\n"
                + "Output ONLY the indices of the " + k + " most relevant passages, most relevant first, "
                + "as comma-separated numbers without spaces inside " + OPEN_MARKER + CLOSE_MARKER + " tags.\n\n"
                + OPEN_MARKER;
    }

    static String enumerate(int index, SearchResult candidate) {
        return "[" + index + "] Section: " + candidate.getSectionHeader() + "\nSummary: " + candidate.getSummary();
    }
}
