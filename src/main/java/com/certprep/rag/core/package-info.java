/**
 * Core value types shared by every retrieval stage.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code Passage} - indexed unit of the corpus with its embedding</li>
 *   <li>{@code SearchResult} - immutable scored passage returned for a query</li>
 *   <li>{@code SearchFilter} - exact-match metadata predicates</li>
 *   <li>{@code RetrievalResult} - results plus the assembled context text</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.certprep.rag.core;
