package com.certprep.rag.configuration;

import lombok.Data;

/**
 * Only read when {@code app.index.provider=pinecone}; required fields are checked then.
 */
@Data
public class PineconeProperties {

    private String apiKey;

    private String indexName;

    private String namespace = "";
}
