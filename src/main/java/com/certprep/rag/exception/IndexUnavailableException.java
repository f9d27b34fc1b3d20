package com.certprep.rag.exception;

import lombok.Getter;

@Getter
public class IndexUnavailableException extends RuntimeException {

    private final String indexName;

    public IndexUnavailableException(String message, String indexName, Throwable cause) {
        super(message, cause);
        this.indexName = indexName;
    }

}
