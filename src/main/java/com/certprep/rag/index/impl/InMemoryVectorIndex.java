package com.certprep.rag.index.impl;

import com.certprep.rag.core.Passage;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.exception.DimensionMismatchException;
import com.certprep.rag.index.IndexDescription;
import com.certprep.rag.index.IndexStatus;
import com.certprep.rag.index.VectorIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact cosine search held entirely in memory.
 *
 * <p>Entries are kept in internal-id order, which is insertion order, so a stable sort on
 * score alone yields the required tie-break. Equality filters resolve through hash
 * indexes on {@code chapter_num} and {@code content_type} before any vector is scored.
 */
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

    private static final List<String> INDEXED_FIELDS = List.of(Passage.CHAPTER_NUM, Passage.CONTENT_TYPE);

    private final String collectionName;
    private final int dimension;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Long> idsByChunk = new HashMap<>();
    private final TreeMap<Long, IndexedPassage> entries = new TreeMap<>();
    // field -> value -> internal ids
    private final Map<String, Map<String, TreeSet<Long>>> secondary = new HashMap<>();
    private long nextId = 0;

    public InMemoryVectorIndex(String collectionName, int dimension) {
        this.collectionName = collectionName;
        this.dimension = dimension;
        INDEXED_FIELDS.forEach(field -> secondary.put(field, new HashMap<>()));
    }

    @Override
    public void upsert(List<Passage> passages) {
        for (Passage passage : passages) {
            DimensionMismatchException.check("Passage " + passage.getChunkId(), dimension, passage.getEmbedding().size());
        }

        lock.writeLock().lock();
        try {
            for (Passage passage : passages) {
                Long id = idsByChunk.get(passage.getChunkId());
                if (id == null) {
                    id = nextId++;
                    idsByChunk.put(passage.getChunkId(), id);
                } else {
                    unindex(id, entries.get(id).passage());
                }
                entries.put(id, new IndexedPassage(id, passage, toArray(passage.getEmbedding())));
                index(id, passage);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Upserted {} passages into '{}' ({} total)", passages.size(), collectionName, entries.size());
    }

    @Override
    public List<SearchResult> search(List<Float> queryVector, int topK, SearchFilter filter) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        DimensionMismatchException.check("Query vector", dimension, queryVector.size());
        float[] query = toArray(queryVector);
        double queryNorm = norm(query);

        lock.readLock().lock();
        try {
            List<Scored> scored = new ArrayList<>();
            for (IndexedPassage entry : candidates(filter == null ? SearchFilter.none() : filter)) {
                scored.add(new Scored(entry, cosine(query, queryNorm, entry)));
            }
            // candidates arrive in id order and List.sort is stable
            scored.sort(Comparator.comparingDouble(Scored::score).reversed());

            List<SearchResult> results = new ArrayList<>(Math.min(topK, scored.size()));
            for (int i = 0; i < scored.size() && i < topK; i++) {
                Scored s = scored.get(i);
                results.add(s.entry().passage().toResult(s.score()));
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public IndexDescription describe() {
        lock.readLock().lock();
        try {
            return IndexDescription.builder()
                    .collectionName(collectionName)
                    .count(entries.size())
                    .dimension(dimension)
                    .status(entries.isEmpty() ? IndexStatus.EMPTY : IndexStatus.READY)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Collection<IndexedPassage> candidates(SearchFilter filter) {
        if (filter.isEmpty()) {
            return entries.values();
        }

        List<Set<Long>> postings = new ArrayList<>(2);
        if (filter.getChapterNum() != null) {
            postings.add(postings(Passage.CHAPTER_NUM, filter.getChapterNum()));
        }
        if (filter.getContentType() != null) {
            postings.add(postings(Passage.CONTENT_TYPE, filter.getContentType().getValue()));
        }
        postings.sort(Comparator.comparingInt(Set::size));

        List<IndexedPassage> matches = new ArrayList<>();
        for (Long id : postings.get(0)) {
            if (postings.stream().allMatch(p -> p.contains(id))) {
                matches.add(entries.get(id));
            }
        }
        return matches;
    }

    private Set<Long> postings(String field, String value) {
        TreeSet<Long> ids = secondary.get(field).get(value);
        return ids == null ? Set.of() : ids;
    }

    private void index(long id, Passage passage) {
        for (String field : INDEXED_FIELDS) {
            String value = passage.getMetadata().get(field);
            if (value != null) {
                secondary.get(field).computeIfAbsent(value, v -> new TreeSet<>()).add(id);
            }
        }
    }

    private void unindex(long id, Passage passage) {
        for (String field : INDEXED_FIELDS) {
            String value = passage.getMetadata().get(field);
            if (value == null) {
                continue;
            }
            Map<String, TreeSet<Long>> byValue = secondary.get(field);
            TreeSet<Long> ids = byValue.get(value);
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) {
                    byValue.remove(value);
                }
            }
        }
    }

    private static double cosine(float[] query, double queryNorm, IndexedPassage entry) {
        if (queryNorm == 0.0 || entry.norm() == 0.0) {
            return 0.0;
        }
        float[] vector = entry.vector();
        double dot = 0.0;
        for (int i = 0; i < vector.length; i++) {
            dot += (double) query[i] * vector[i];
        }
        return dot / (queryNorm * entry.norm());
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    private static float[] toArray(List<Float> vector) {
        float[] array = new float[vector.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = vector.get(i);
        }
        return array;
    }

    private record IndexedPassage(long id, Passage passage, float[] vector, double norm) {
        IndexedPassage(long id, Passage passage, float[] vector) {
            this(id, passage, vector, InMemoryVectorIndex.norm(vector));
        }
    }

    private record Scored(IndexedPassage entry, double score) {
    }
}
