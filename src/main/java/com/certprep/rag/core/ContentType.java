package com.certprep.rag.core;

/**
 * Kind of study material a passage was cut from.
 *
 * <p>The wire value is what is stored under {@code content_type} in passage metadata
 * and what filters compare against.
 */
public enum ContentType {
    VIDEO("video"),
    TEXT("text"),
    CHAPTER_INTRO("chapter_intro");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
