package com.certprep.rag.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of exact-match predicates over passage metadata.
 *
 * <p>A {@code null} field places no constraint; a filter with no fields set matches
 * every passage.
 */
@Value
@Builder(toBuilder = true)
public class SearchFilter {

    private static final SearchFilter NONE = SearchFilter.builder().build();

    String chapterNum;
    ContentType contentType;

    public static SearchFilter none() {
        return NONE;
    }

    public static SearchFilter forChapter(String chapterNum) {
        return SearchFilter.builder().chapterNum(chapterNum).build();
    }

    public boolean isEmpty() {
        return chapterNum == null && contentType == null;
    }

    public boolean matches(Map<String, String> metadata) {
        if (chapterNum != null && !Objects.equals(chapterNum, metadata.get(Passage.CHAPTER_NUM))) {
            return false;
        }
        return contentType == null
                || Objects.equals(contentType.getValue(), metadata.get(Passage.CONTENT_TYPE));
    }
}
