package com.certprep.rag.config;

import com.certprep.rag.configuration.AppProperties;
import com.certprep.rag.configuration.IndexProperties;
import com.certprep.rag.configuration.PineconeProperties;
import com.certprep.rag.index.VectorIndex;
import com.certprep.rag.index.impl.InMemoryVectorIndex;
import com.certprep.rag.index.impl.PineconeVectorIndex;
import io.pinecone.clients.Pinecone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the vector index selected by {@code app.index.provider}.
 *
 * The Pinecone client is only built when Pinecone is selected.
 */
@Slf4j
@Configuration
public class VectorIndexConfig {

    @Bean
    public VectorIndex vectorIndex(AppProperties props) {
        IndexProperties index = props.getIndex();
        String provider = index.getProvider().toLowerCase();

        VectorIndex vectorIndex = switch (provider) {
            case "memory" -> new InMemoryVectorIndex(index.getCollectionName(), index.getDimension());
            case "pinecone" -> pinecone(props.getPinecone(), index);
            default -> throw new IllegalStateException("Unknown index provider: " + provider);
        };
        log.info("🗂️ Vector index: {} (collection={}, dimension={})",
                provider, index.getCollectionName(), index.getDimension());
        return vectorIndex;
    }

    private static VectorIndex pinecone(PineconeProperties pinecone, IndexProperties index) {
        if (pinecone.getApiKey() == null || pinecone.getApiKey().isBlank()) {
            throw new IllegalStateException("app.pinecone.api-key is required for the pinecone index");
        }
        String indexName = pinecone.getIndexName() == null || pinecone.getIndexName().isBlank()
                ? index.getCollectionName().replace('_', '-')
                : pinecone.getIndexName();
        Pinecone client = new Pinecone.Builder(pinecone.getApiKey()).build();
        return new PineconeVectorIndex(client, indexName, pinecone.getNamespace(), index.getDimension());
    }
}
