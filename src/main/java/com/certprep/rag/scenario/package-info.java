/**
 * Scenario questions: multi-query expansion over answer options and exam question parsing.
 *
 * @since 1.0.0
 */
package com.certprep.rag.scenario;
