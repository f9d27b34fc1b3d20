/**
 * First-stage retrieval and context assembly.
 *
 * @since 1.0.0
 */
package com.certprep.rag.search;
