package com.certprep.rag.scenario;

import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;

import java.util.List;

/**
 * Retrieval for multiple-choice questions with a scenario preamble.
 *
 * <p>One query for scenario plus question finds the general topic; one narrower query
 * per answer option finds evidence that can tell the options apart. Results are
 * merged by chunk id, ranked by score and capped.
 */
public interface ScenarioQueryExpander {

    /**
     * @param scenario preamble, may be blank
     * @param question the question itself, must not be blank
     * @param options answer options in presentation order, may be empty
     * @param k results wanted for the main query, must be positive
     */
    RetrievalResult retrieveForScenario(String scenario, String question, List<String> options,
                                        int k, SearchFilter filter);
}
