package com.certprep.rag.index.impl;

import com.certprep.rag.core.Passage;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.exception.DimensionMismatchException;
import com.certprep.rag.exception.IndexUnavailableException;
import com.certprep.rag.index.IndexDescription;
import com.certprep.rag.index.IndexStatus;
import com.certprep.rag.index.VectorIndex;
import com.certprep.rag.model.CallContext;
import com.certprep.rag.model.ServiceType;
import com.certprep.rag.util.ExternalCallLogger;
import com.google.protobuf.ListValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import io.pinecone.proto.DescribeIndexStatsResponse;
import io.pinecone.proto.FetchResponse;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vector index stored in a Pinecone index (cosine metric, dimension fixed at creation).
 *
 * <p>Passage text and metadata are kept as flat Pinecone metadata so a query needs no
 * second lookup. Pinecone gives no ordering guarantee among equal scores, so every
 * vector carries a {@code point_id} assigned on first upsert and results are re-sorted
 * by score, then point id.
 */
@Slf4j
public class PineconeVectorIndex implements VectorIndex {

    static final String CHUNK_ID = "chunk_id";
    static final String CONTENT = "content";
    static final String SUMMARY = "summary";
    static final String SECTION_HEADER = "section_header";
    static final String POINT_ID = "point_id";

    private static final int UPSERT_BATCH_SIZE = 100;

    private final Pinecone client;
    private final String indexName;
    private final String namespace;
    private final int dimension;

    private long nextPointId = -1;

    public PineconeVectorIndex(Pinecone client, String indexName, String namespace, int dimension) {
        this.client = client;
        this.indexName = indexName;
        this.namespace = namespace == null ? "" : namespace;
        this.dimension = dimension;
    }

    @Override
    public synchronized void upsert(List<Passage> passages) {
        for (Passage passage : passages) {
            DimensionMismatchException.check("Passage " + passage.getChunkId(), dimension, passage.getEmbedding().size());
        }
        if (passages.isEmpty()) {
            return;
        }

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "upsert", log);
        callCtx.logRequest(passages.size() + " passages", "Index", indexName, "Namespace", namespace);

        try {
            Index index = client.getIndexConnection(indexName);
            for (int i = 0; i < passages.size(); i += UPSERT_BATCH_SIZE) {
                List<Passage> batch = passages.subList(i, Math.min(i + UPSERT_BATCH_SIZE, passages.size()));
                Map<String, Long> pointIds = resolvePointIds(index, batch);

                List<VectorWithUnsignedIndices> vectors = new ArrayList<>(batch.size());
                for (Passage passage : batch) {
                    vectors.add(new VectorWithUnsignedIndices(
                            passage.getChunkId(),
                            passage.getEmbedding(),
                            toMetadata(passage, pointIds.get(passage.getChunkId())),
                            null));
                }
                index.upsert(vectors, namespace);
                log.debug("Upserted batch {}-{} of {}", i, i + batch.size(), passages.size());
            }
            callCtx.logResponse("Upsert complete");

        } catch (RuntimeException e) {
            callCtx.logError(e.getMessage(), e);
            throw new IndexUnavailableException("Pinecone upsert failed", indexName, e);
        }
    }

    @Override
    public List<SearchResult> search(List<Float> queryVector, int topK, SearchFilter filter) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        DimensionMismatchException.check("Query vector", dimension, queryVector.size());

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "query", log);
        Struct pineconeFilter = buildFilter(filter);
        callCtx.logRequest("topK=" + topK,
                "Index", indexName,
                "Filter", pineconeFilter == null ? "none" : pineconeFilter.getFieldsMap().keySet());

        QueryResponseWithUnsignedIndices response;
        try {
            response = client.getIndexConnection(indexName)
                    .query(topK, queryVector, null, null, null, namespace, pineconeFilter, false, true);
        } catch (RuntimeException e) {
            callCtx.logError(e.getMessage(), e);
            throw new IndexUnavailableException("Pinecone query failed", indexName, e);
        }

        List<ScoredVectorWithUnsignedIndices> matches =
                response == null || response.getMatchesList() == null ? List.of() : response.getMatchesList();
        List<SearchResult> results = toResults(matches);
        callCtx.logResponse(results.size() + " matches");
        return results;
    }

    @Override
    public IndexDescription describe() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "describeIndexStats", log);
        callCtx.logRequest("Index " + indexName);
        try {
            DescribeIndexStatsResponse stats = client.getIndexConnection(indexName).describeIndexStats();
            long count = stats.getTotalVectorCount();
            callCtx.logResponse(count + " vectors");
            return IndexDescription.builder()
                    .collectionName(indexName)
                    .count(count)
                    .dimension(stats.getDimension())
                    .status(count == 0 ? IndexStatus.EMPTY : IndexStatus.READY)
                    .build();
        } catch (RuntimeException e) {
            callCtx.logError(e.getMessage(), e);
            return IndexDescription.builder()
                    .collectionName(indexName)
                    .dimension(dimension)
                    .status(IndexStatus.UNAVAILABLE)
                    .error(e.getMessage())
                    .build();
        }
    }

    /**
     * Translates a filter into Pinecone's metadata filter language, e.g.
     * <pre>
     * {"$and": [{"chapter_num": {"$eq": "3"}}, {"content_type": {"$eq": "video"}}]}
     * </pre>
     * Returns null when the filter places no constraint.
     */
    static Struct buildFilter(SearchFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        List<Struct> clauses = new ArrayList<>(2);
        if (filter.getChapterNum() != null) {
            clauses.add(eq(Passage.CHAPTER_NUM, filter.getChapterNum()));
        }
        if (filter.getContentType() != null) {
            clauses.add(eq(Passage.CONTENT_TYPE, filter.getContentType().getValue()));
        }
        if (clauses.size() == 1) {
            return clauses.get(0);
        }

        ListValue.Builder and = ListValue.newBuilder();
        clauses.forEach(clause -> and.addValues(Value.newBuilder().setStructValue(clause).build()));
        return Struct.newBuilder()
                .putFields("$and", Value.newBuilder().setListValue(and).build())
                .build();
    }

    static Struct toMetadata(Passage passage, long pointId) {
        Struct.Builder metadata = Struct.newBuilder();
        passage.getMetadata().forEach((key, value) -> metadata.putFields(key, stringValue(value)));
        metadata.putFields(CHUNK_ID, stringValue(passage.getChunkId()));
        metadata.putFields(CONTENT, stringValue(passage.getContent()));
        metadata.putFields(SUMMARY, stringValue(passage.getSummary()));
        metadata.putFields(SECTION_HEADER, stringValue(passage.getSectionHeader()));
        metadata.putFields(POINT_ID, Value.newBuilder().setNumberValue(pointId).build());
        return metadata.build();
    }

    static List<SearchResult> toResults(List<ScoredVectorWithUnsignedIndices> matches) {
        List<Match> ordered = new ArrayList<>(matches.size());
        for (ScoredVectorWithUnsignedIndices match : matches) {
            Map<String, Value> fields = fieldsOf(match);
            long pointId = fields.containsKey(POINT_ID) ? (long) fields.get(POINT_ID).getNumberValue() : Long.MAX_VALUE;
            ordered.add(new Match(match, pointId));
        }
        ordered.sort(Comparator.comparingDouble((Match m) -> m.vector().getScore()).reversed()
                .thenComparingLong(Match::pointId));

        List<SearchResult> results = new ArrayList<>(ordered.size());
        for (Match match : ordered) {
            Map<String, Value> fields = fieldsOf(match.vector());
            Map<String, String> metadata = new LinkedHashMap<>();
            fields.forEach((key, value) -> {
                if (!isPayloadField(key)) {
                    metadata.put(key, value.hasNumberValue() ? formatNumber(value.getNumberValue()) : value.getStringValue());
                }
            });
            results.add(SearchResult.builder()
                    .chunkId(text(fields, CHUNK_ID, match.vector().getId()))
                    .content(text(fields, CONTENT, ""))
                    .summary(text(fields, SUMMARY, ""))
                    .sectionHeader(text(fields, SECTION_HEADER, ""))
                    .metadata(Map.copyOf(metadata))
                    .score(match.vector().getScore())
                    .build());
        }
        return results;
    }

    private Map<String, Long> resolvePointIds(Index index, List<Passage> batch) {
        if (nextPointId < 0) {
            nextPointId = index.describeIndexStats().getTotalVectorCount();
        }
        List<String> ids = batch.stream().map(Passage::getChunkId).toList();
        FetchResponse existing = index.fetch(ids, namespace);

        Map<String, Long> pointIds = new HashMap<>();
        for (String id : ids) {
            io.pinecone.proto.Vector stored = existing == null ? null : existing.getVectorsMap().get(id);
            if (stored != null && stored.getMetadata().getFieldsMap().containsKey(POINT_ID)) {
                pointIds.put(id, (long) stored.getMetadata().getFieldsMap().get(POINT_ID).getNumberValue());
            } else {
                pointIds.put(id, nextPointId++);
            }
        }
        return pointIds;
    }

    private static Map<String, Value> fieldsOf(ScoredVectorWithUnsignedIndices match) {
        return match.getMetadata() == null ? Map.of() : match.getMetadata().getFieldsMap();
    }

    private static boolean isPayloadField(String key) {
        return CHUNK_ID.equals(key) || CONTENT.equals(key) || SUMMARY.equals(key)
                || SECTION_HEADER.equals(key) || POINT_ID.equals(key);
    }

    private static String text(Map<String, Value> fields, String key, String fallback) {
        Value value = fields.get(key);
        return value == null ? fallback : value.getStringValue();
    }

    private static String formatNumber(double number) {
        return number == Math.rint(number) ? Long.toString((long) number) : Double.toString(number);
    }

    private static Struct eq(String field, String value) {
        return Struct.newBuilder()
                .putFields(field, Value.newBuilder()
                        .setStructValue(Struct.newBuilder().putFields("$eq", stringValue(value)).build())
                        .build())
                .build();
    }

    private static Value stringValue(String value) {
        return Value.newBuilder().setStringValue(value == null ? "" : value).build();
    }

    private record Match(ScoredVectorWithUnsignedIndices vector, long pointId) {
    }
}
