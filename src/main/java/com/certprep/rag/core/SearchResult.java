package com.certprep.rag.core;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * A passage returned for a query together with its relevance score.
 *
 * <p>Within one returned list scores never increase from one element to the next.
 * Instances are immutable; stages that re-score results create new instances
 * through {@link #withScore(double)}.
 */
@Value
@Builder(toBuilder = true)
public class SearchResult {

    String chunkId;
    String content;
    String summary;
    String sectionHeader;
    Map<String, String> metadata;

    @With
    double score;

    public String getChapterNum() {
        return metadata == null ? null : metadata.get(Passage.CHAPTER_NUM);
    }

    public String getContentType() {
        return metadata == null ? null : metadata.get(Passage.CONTENT_TYPE);
    }
}
