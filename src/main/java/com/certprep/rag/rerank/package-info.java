/**
 * Candidate reranking with a language-model judge.
 *
 * <p>The judge sees only section headers and summaries and answers with an index list.
 * Any failure falls back to the upstream order.
 *
 * @since 1.0.0
 */
package com.certprep.rag.rerank;
