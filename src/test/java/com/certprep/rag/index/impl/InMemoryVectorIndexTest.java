package com.certprep.rag.index.impl;

import com.certprep.rag.core.ContentType;
import com.certprep.rag.core.SearchFilter;
import com.certprep.rag.core.SearchResult;
import com.certprep.rag.exception.DimensionMismatchException;
import com.certprep.rag.index.IndexDescription;
import com.certprep.rag.index.IndexStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.certprep.rag.support.TestPassages.ids;
import static com.certprep.rag.support.TestPassages.passage;
import static com.certprep.rag.support.TestPassages.vector;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("In-memory vector index")
class InMemoryVectorIndexTest {

    private InMemoryVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex("test", 3);
    }

    @Test
    @DisplayName("Should return matches by descending cosine similarity")
    void search_ShouldOrderByCosine() {
        // Given
        index.upsert(List.of(
                passage("A", "1", ContentType.TEXT, 0f, 1f, 0f),
                passage("B", "1", ContentType.TEXT, 1f, 0f, 0f),
                passage("C", "2", ContentType.VIDEO, 1f, 1f, 0f)));

        // When
        List<SearchResult> results = index.search(vector(1f, 0f, 0f), 3, SearchFilter.none());

        // Then
        assertThat(ids(results)).containsExactly("B", "C", "A");
        assertThat(results.get(0).getScore()).isCloseTo(1.0, within(1e-6));
        assertThat(results.get(1).getScore()).isCloseTo(Math.sqrt(0.5), within(1e-6));
        assertThat(results.get(2).getScore()).isZero();
    }

    @Test
    @DisplayName("Should break score ties by insertion order")
    void search_ShouldBreakTiesByInsertionOrder() {
        // Given: three identical embeddings inserted as Z, A, M
        index.upsert(List.of(passage("Z", "1", ContentType.TEXT, 1f, 0f, 0f)));
        index.upsert(List.of(
                passage("A", "1", ContentType.TEXT, 1f, 0f, 0f),
                passage("M", "1", ContentType.TEXT, 1f, 0f, 0f)));

        // When
        List<SearchResult> results = index.search(vector(1f, 0f, 0f), 2, SearchFilter.none());

        // Then
        assertThat(ids(results)).containsExactly("Z", "A");
    }

    @Test
    @DisplayName("Should keep the original position when a passage is upserted again")
    void upsert_ShouldBeIdempotentPerChunkId() {
        // Given
        index.upsert(List.of(
                passage("first", "1", ContentType.TEXT, 1f, 0f, 0f),
                passage("second", "1", ContentType.TEXT, 1f, 0f, 0f)));

        // When: first is replaced with new metadata
        index.upsert(List.of(passage("first", "4", ContentType.VIDEO, 1f, 0f, 0f)));

        // Then
        assertThat(index.describe().getCount()).isEqualTo(2);
        assertThat(ids(index.search(vector(1f, 0f, 0f), 5, SearchFilter.none())))
                .containsExactly("first", "second");
        assertThat(ids(index.search(vector(1f, 0f, 0f), 5, SearchFilter.forChapter("1"))))
                .containsExactly("second");
        assertThat(ids(index.search(vector(1f, 0f, 0f), 5, SearchFilter.forChapter("4"))))
                .containsExactly("first");
    }

    @Test
    @DisplayName("Should only return passages satisfying every filter predicate")
    void search_ShouldApplyConjunctiveFilter() {
        // Given
        index.upsert(List.of(
                passage("c1-text", "1", ContentType.TEXT, 1f, 0f, 0f),
                passage("c1-video", "1", ContentType.VIDEO, 1f, 0f, 0f),
                passage("c2-video", "2", ContentType.VIDEO, 1f, 0f, 0f)));
        SearchFilter filter = SearchFilter.builder().chapterNum("1").contentType(ContentType.VIDEO).build();

        // When
        List<SearchResult> results = index.search(vector(1f, 0f, 0f), 10, filter);

        // Then
        assertThat(ids(results)).containsExactly("c1-video");
        assertThat(results).allSatisfy(r -> assertThat(filter.matches(r.getMetadata())).isTrue());
    }

    @Test
    @DisplayName("Should return an empty list when nothing matches the filter")
    void search_ShouldReturnEmptyForUnmatchedFilter() {
        index.upsert(List.of(passage("A", "1", ContentType.TEXT, 1f, 0f, 0f)));

        assertThat(index.search(vector(1f, 0f, 0f), 5, SearchFilter.forChapter("99"))).isEmpty();
    }

    @Test
    @DisplayName("Should cap results at topK")
    void search_ShouldCapAtTopK() {
        index.upsert(List.of(
                passage("A", "1", ContentType.TEXT, 1f, 0f, 0f),
                passage("B", "1", ContentType.TEXT, 0.9f, 0.1f, 0f),
                passage("C", "1", ContentType.TEXT, 0.8f, 0.2f, 0f)));

        assertThat(index.search(vector(1f, 0f, 0f), 2, null)).hasSize(2);
    }

    @Test
    @DisplayName("Should reject vectors of the wrong dimension")
    void shouldRejectDimensionMismatch() {
        assertThatThrownBy(() -> index.upsert(List.of(passage("A", "1", ContentType.TEXT, 1f, 0f))))
                .isInstanceOf(DimensionMismatchException.class)
                .satisfies(e -> {
                    DimensionMismatchException mismatch = (DimensionMismatchException) e;
                    assertThat(mismatch.getExpected()).isEqualTo(3);
                    assertThat(mismatch.getActual()).isEqualTo(2);
                });

        assertThatThrownBy(() -> index.search(vector(1f, 0f, 0f, 0f), 1, SearchFilter.none()))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Should describe count, dimension and status")
    void describe_ShouldReportState() {
        assertThat(index.describe().getStatus()).isEqualTo(IndexStatus.EMPTY);

        index.upsert(List.of(passage("A", "1", ContentType.TEXT, 1f, 0f, 0f)));
        IndexDescription description = index.describe();

        assertThat(description.getCount()).isEqualTo(1);
        assertThat(description.getDimension()).isEqualTo(3);
        assertThat(description.getDistanceMetric()).isEqualTo("Cosine");
        assertThat(description.getStatus()).isEqualTo(IndexStatus.READY);
    }
}
