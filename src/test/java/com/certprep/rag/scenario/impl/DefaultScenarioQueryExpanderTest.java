package com.certprep.rag.scenario.impl;

import com.certprep.rag.configuration.RetrievalProperties;
import com.certprep.rag.core.RetrievalResult;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.search.ContextAssembler;
import com.certprep.rag.support.StubRetriever;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.certprep.rag.support.TestPassages.ids;
import static com.certprep.rag.support.TestPassages.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Scenario query expander")
class DefaultScenarioQueryExpanderTest {

    private static final String SCENARIO = "A user reports a suspicious email asking for payroll data.";
    private static final String QUESTION = "Which attack is this?";

    private StubRetriever retriever;
    private RetrievalProperties properties;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        retriever = new StubRetriever();
        properties = new RetrievalProperties();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should issue one main query and one smaller query per option")
    void shouldShapeSubQueries() {
        // Given
        DefaultScenarioQueryExpander expander = sequential();
        SearchFilter filter = SearchFilter.forChapter("2");

        // When
        expander.retrieveForScenario(SCENARIO, QUESTION, List.of("Phishing", "Vishing"), 10, filter);

        // Then
        assertThat(retriever.getCalls()).containsExactly(
                new StubRetriever.Call(SCENARIO + " " + QUESTION, 10, filter),
                new StubRetriever.Call(QUESTION + " Phishing", 5, filter),
                new StubRetriever.Call(QUESTION + " Vishing", 5, filter));
    }

    @Test
    @DisplayName("Should issue a query for every option, blank ones on the question alone")
    void shouldQueryBlankOptions() {
        sequential().retrieveForScenario(SCENARIO, QUESTION, Arrays.asList("x", " ", null, "y"), 6,
                SearchFilter.none());

        assertThat(retriever.getCalls()).extracting(StubRetriever.Call::query).containsExactly(
                SCENARIO + " " + QUESTION, QUESTION + " x", QUESTION, QUESTION, QUESTION + " y");
    }

    @Test
    @DisplayName("Should never ask options for fewer than three results")
    void shouldUseMinimumOptionK() {
        sequential().retrieveForScenario(SCENARIO, QUESTION, List.of("Phishing"), 4, SearchFilter.none());

        assertThat(retriever.getCalls().get(1).k()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep the first copy of a passage surfaced by several queries")
    void shouldDeduplicateWithFirstSurfacingPrecedence() {
        // Given
        retriever.on(SCENARIO + " " + QUESTION, result("X", 0.90), result("Y", 0.70));
        retriever.on(QUESTION + " Phishing", result("Y", 0.95), result("Z", 0.80));

        // When
        RetrievalResult result = sequential().retrieveForScenario(SCENARIO, QUESTION, List.of("Phishing"), 3,
                SearchFilter.none());

        // Then
        assertThat(ids(result.getResults())).containsExactly("X", "Z", "Y");
        assertThat(result.getResults().get(2).getScore()).isEqualTo(0.70);
        assertThat(result.getContext()).isEqualTo(ContextAssembler.assemble(result.getResults()));
    }

    @Test
    @DisplayName("Should count overlapping passages once")
    void shouldMergeOverlapOnce() {
        // Given: main returns 6, one option returns 4 of which 2 overlap
        retriever.on(SCENARIO + " " + QUESTION,
                result("m1", 0.9), result("m2", 0.85), result("m3", 0.8),
                result("m4", 0.75), result("m5", 0.7), result("m6", 0.65));
        retriever.on(QUESTION + " Vishing",
                result("m2", 0.88), result("o1", 0.6), result("m5", 0.55), result("o2", 0.5));

        // When
        RetrievalResult result = sequential().retrieveForScenario(SCENARIO, QUESTION, List.of("Vishing"), 8,
                SearchFilter.none());

        // Then: option k is 4, so the option query returns all four
        assertThat(result.getResults()).hasSize(8);
        assertThat(ids(result.getResults())).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should cap the merged list at twelve, best scores first")
    void shouldCapMergedResults() {
        // Given: 10 from the main query and 3 new per option for 4 options
        List<SearchResult> main = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            main.add(result("main-" + i, 0.90 - i * 0.01));
        }
        retriever.on(SCENARIO + " " + QUESTION, main.toArray(SearchResult[]::new));
        List<String> options = List.of("A", "B", "C", "D");
        for (int o = 0; o < options.size(); o++) {
            retriever.on(QUESTION + " " + options.get(o),
                    result(options.get(o) + "-0", 0.95 - o * 0.1),
                    result(options.get(o) + "-1", 0.50),
                    result(options.get(o) + "-2", 0.40));
        }

        // When
        RetrievalResult result = sequential().retrieveForScenario(SCENARIO, QUESTION, options, 10,
                SearchFilter.none());

        // Then
        assertThat(result.getResults()).hasSize(12);
        assertThat(result.getResults()).extracting(SearchResult::getScore)
                .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(ids(result.getResults())).startsWith("A-0", "main-0", "main-1");
    }

    @Test
    @DisplayName("Should produce the same result when sub-queries run concurrently")
    void shouldMatchSequentialWhenParallel() {
        // Given
        retriever.on(SCENARIO + " " + QUESTION, result("X", 0.9), result("Y", 0.7));
        retriever.on(QUESTION + " Phishing", result("Y", 0.7), result("P", 0.7));
        retriever.on(QUESTION + " Vishing", result("P", 0.7), result("V", 0.7));
        List<String> options = List.of("Phishing", "Vishing");
        pool = Executors.newFixedThreadPool(3);

        // When
        RetrievalResult sequential = sequential().retrieveForScenario(SCENARIO, QUESTION, options, 3,
                SearchFilter.none());
        RetrievalResult parallel = new DefaultScenarioQueryExpander(retriever, properties, pool)
                .retrieveForScenario(SCENARIO, QUESTION, options, 3, SearchFilter.none());

        // Then
        assertThat(parallel).isEqualTo(sequential);
        assertThat(ids(parallel.getResults())).containsExactly("X", "Y", "P", "V");
    }

    @Test
    @DisplayName("Should fall back to the plain question when there is no scenario or options")
    void shouldHandleBareQuestion() {
        retriever.on(QUESTION, result("X", 0.9));

        RetrievalResult result = sequential().retrieveForScenario("", QUESTION, List.of(), 3, SearchFilter.none());

        assertThat(ids(result.getResults())).containsExactly("X");
        assertThat(retriever.getCalls()).hasSize(1);
    }

    @Test
    @DisplayName("Should return an empty result when no query finds anything")
    void shouldReturnEmptyResult() {
        RetrievalResult result = sequential().retrieveForScenario(SCENARIO, QUESTION, List.of("A", "B"), 3,
                SearchFilter.none());

        assertThat(result).isEqualTo(RetrievalResult.empty());
        assertThat(result.getContext()).isEmpty();
    }

    @Test
    @DisplayName("Should propagate sub-query failures unwrapped")
    void shouldPropagateFailures() {
        pool = Executors.newSingleThreadExecutor();
        DefaultScenarioQueryExpander expander = new DefaultScenarioQueryExpander(
                new StubRetriever() {
                    @Override
                    public RetrievalResult retrieve(String queryText, int k, SearchFilter filter) {
                        throw new IllegalStateException("index down");
                    }
                }, properties, pool);

        assertThatThrownBy(() -> expander.retrieveForScenario(SCENARIO, QUESTION, List.of("A"), 3,
                SearchFilter.none()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("index down");
    }

    @Test
    @DisplayName("Should reject non-positive k")
    void shouldRejectInvalidK() {
        assertThatThrownBy(() -> sequential().retrieveForScenario(SCENARIO, QUESTION, List.of(), 0,
                SearchFilter.none()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private DefaultScenarioQueryExpander sequential() {
        return new DefaultScenarioQueryExpander(retriever, properties, Runnable::run);
    }
}
