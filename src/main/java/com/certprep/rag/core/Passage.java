package com.certprep.rag.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A retrievable unit of the study corpus.
 *
 * <p>Passages are produced by the offline pipeline (chunking, summarization,
 * embedding) and are read-only once they are in the index.
 */
@Value
@Builder(toBuilder = true)
public class Passage {

    public static final String CHAPTER_NUM = "chapter_num";
    public static final String SECTION_NUM = "section_num";
    public static final String CONTENT_TYPE = "content_type";

    String chunkId;
    String content;
    String summary;
    String sectionHeader;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    List<Float> embedding;

    public String getChapterNum() {
        return metadata.get(CHAPTER_NUM);
    }

    public String getContentType() {
        return metadata.get(CONTENT_TYPE);
    }

    /**
     * Projects this passage into a scored result, without the embedding.
     */
    public SearchResult toResult(double score) {
        return SearchResult.builder()
                .chunkId(chunkId)
                .content(content)
                .summary(summary)
                .sectionHeader(sectionHeader)
                .metadata(metadata)
                .score(score)
                .build();
    }
}
