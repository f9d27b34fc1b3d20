package com.certprep.rag.exception;

import lombok.Getter;

/**
 * Raised when the embedding provider cannot turn a query into a vector.
 */
@Getter
public class EmbeddingException extends RuntimeException {

    private final String modelName;

    public EmbeddingException(String message, String modelName, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
    }

}
