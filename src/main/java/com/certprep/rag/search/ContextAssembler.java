package com.certprep.rag.search;

import com.certprep.rag.core.SearchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders results into the context text handed to the answering model.
 *
 * <p>Each result becomes
 * <pre>
 * \n&lt;document&gt;\n{section_header}\n\nText:\n{content}\n\nSummary:\n{summary}\n&lt;/document&gt;\n
 * </pre>
 * and blocks are concatenated in result order with nothing in between. Downstream
 * prompts depend on this layout byte for byte.
 */
public final class ContextAssembler {

    static final String OPEN = "\n<document>\n";
    static final String TEXT = "\n\nText:\n";
    static final String SUMMARY = "\n\nSummary:\n";
    static final String CLOSE = "\n</document>\n";

    private ContextAssembler() {
    }

    public static String assemble(List<SearchResult> results) {
        StringBuilder sb = new StringBuilder();
        for (SearchResult result : results) {
            sb.append(OPEN)
                    .append(nullToEmpty(result.getSectionHeader()))
                    .append(TEXT)
                    .append(nullToEmpty(result.getContent()))
                    .append(SUMMARY)
                    .append(nullToEmpty(result.getSummary()))
                    .append(CLOSE);
        }
        return sb.toString();
    }

    /**
     * Splits an assembled context back into its blocks.
     *
     * <p>A block splits on its first {@code Text:} and last {@code Summary:} separator, so a
     * header containing the former or a summary containing the latter does not round-trip.
     * Summaries must also not contain the closing tag followed by another block.
     *
     * @throws IllegalArgumentException if the text is not an assembled context
     */
    public static List<ContextBlock> parse(String context) {
        List<ContextBlock> blocks = new ArrayList<>();
        int pos = 0;
        while (pos < context.length()) {
            if (!context.startsWith(OPEN, pos)) {
                throw new IllegalArgumentException("Expected <document> at offset " + pos);
            }
            int bodyStart = pos + OPEN.length();
            int end = findBlockEnd(context, bodyStart);
            String body = context.substring(bodyStart, end);

            int text = body.indexOf(TEXT);
            int summary = body.lastIndexOf(SUMMARY);
            if (text < 0 || summary < text) {
                throw new IllegalArgumentException("Malformed document block at offset " + pos);
            }
            blocks.add(new ContextBlock(
                    body.substring(0, text),
                    body.substring(text + TEXT.length(), summary),
                    body.substring(summary + SUMMARY.length())));
            pos = end + CLOSE.length();
        }
        return blocks;
    }

    // the block ends at the first closing tag followed by another block or the end of text
    private static int findBlockEnd(String context, int from) {
        int end = context.indexOf(CLOSE, from);
        while (end >= 0) {
            int next = end + CLOSE.length();
            if (next == context.length() || context.startsWith(OPEN, next)) {
                return end;
            }
            end = context.indexOf(CLOSE, end + 1);
        }
        throw new IllegalArgumentException("Unterminated document block at offset " + from);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
