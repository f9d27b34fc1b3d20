package com.certprep.rag.search;

/**
 * One passage as it appears in an assembled context.
 */
public record ContextBlock(String sectionHeader, String content, String summary) {
}
