package com.certprep.rag.index.impl;

import com.certprep.rag.configuration.AppProperties;
import com.certprep.rag.core.Passage;
import com.certprep.rag.exception.DimensionMismatchException;
import com.certprep.rag.index.CorpusIngestService;
import com.certprep.rag.index.VectorIndex;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the embeddings file written by the offline pipeline:
 * <pre>
 * {
 *   "num_chunks": 2,
 *   "embedding_dimension": 1536,
 *   "chunks": [
 *     {"chunk_id": "...", "embedding": [...], "content": "...", "summary": "...",
 *      "section_header": "...", "metadata": {"chapter_num": 1, "section_num": 2, "content_type": "text"}}
 *   ]
 * }
 * </pre>
 * Metadata values are stored as strings so filters compare them exactly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JsonCorpusIngestServiceImpl implements CorpusIngestService {

    private final VectorIndex vectorIndex;
    private final AppProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public int ingest(Path embeddingsFile) {
        log.info("📥 Loading corpus from {}", embeddingsFile);

        JsonNode root;
        try (Reader reader = Files.newBufferedReader(embeddingsFile)) {
            root = objectMapper.readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read corpus file " + embeddingsFile, e);
        }

        int dimension = props.getIndex().getDimension();
        if (root.hasNonNull("embedding_dimension")) {
            DimensionMismatchException.check("Corpus " + embeddingsFile.getFileName(),
                    dimension, root.get("embedding_dimension").asInt());
        }

        JsonNode chunks = root.path("chunks");
        if (!chunks.isArray()) {
            throw new IllegalArgumentException("Corpus file has no 'chunks' array: " + embeddingsFile);
        }

        List<Passage> passages = new ArrayList<>(chunks.size());
        for (JsonNode chunk : chunks) {
            passages.add(toPassage(chunk));
        }
        if (root.has("num_chunks") && root.get("num_chunks").asInt() != passages.size()) {
            log.warn("Corpus declares {} chunks but contains {}", root.get("num_chunks").asInt(), passages.size());
        }

        int batchSize = props.getIndex().getUpsertBatchSize();
        for (int i = 0; i < passages.size(); i += batchSize) {
            int end = Math.min(i + batchSize, passages.size());
            vectorIndex.upsert(passages.subList(i, end));
            log.debug("Ingested passages {}-{} of {}", i, end, passages.size());
        }

        log.info("✅ Ingested {} passages into '{}'", passages.size(), props.getIndex().getCollectionName());
        return passages.size();
    }

    private Passage toPassage(JsonNode chunk) {
        String chunkId = chunk.path("chunk_id").asText(null);
        if (chunkId == null || chunkId.isBlank()) {
            throw new IllegalArgumentException("Corpus chunk without chunk_id");
        }

        List<Float> embedding = new ArrayList<>(chunk.path("embedding").size());
        for (JsonNode value : chunk.path("embedding")) {
            embedding.add(value.floatValue());
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = chunk.path("metadata").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull() && field.getValue().isValueNode()) {
                metadata.put(field.getKey(), field.getValue().asText());
            }
        }

        return Passage.builder()
                .chunkId(chunkId)
                .content(chunk.path("content").asText(""))
                .summary(chunk.path("summary").asText(""))
                .sectionHeader(chunk.path("section_header").asText(""))
                .metadata(metadata)
                .embedding(List.copyOf(embedding))
                .build();
    }
}
