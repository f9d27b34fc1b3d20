package com.certprep.rag.index;

import java.nio.file.Path;

/**
 * Loads a precomputed corpus (passages with their embeddings) into the vector index.
 *
 * Runs offline, before the index is opened for queries.
 */
public interface CorpusIngestService {

    /**
     * @return number of passages written
     */
    int ingest(Path embeddingsFile);
}
