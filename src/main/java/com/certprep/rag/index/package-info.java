/**
 * Vector index: passage storage, cosine search and metadata filtering.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code VectorIndex} - store contract shared by all backends</li>
 *   <li>{@code InMemoryVectorIndex} - exact in-process search with hash indexes on chapter and content type</li>
 *   <li>{@code PineconeVectorIndex} - managed Pinecone index</li>
 *   <li>{@code JsonCorpusIngestServiceImpl} - loads embeddings.json in batches</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.certprep.rag.index;
