package com.certprep.rag.search;

import com.certprep.rag.core.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Context assembly")
class ContextAssemblerTest {

    @Test
    @DisplayName("Should render each result in the fixed document layout")
    void assemble_ShouldUseExactLayout() {
        SearchResult result = SearchResult.builder()
                .chunkId("c1")
                .sectionHeader("Chapter 4 > Firewalls")
                .content("A stateful firewall tracks connections.")
                .summary("Stateful firewalls.")
                .metadata(Map.of())
                .score(0.9)
                .build();

        String context = ContextAssembler.assemble(List.of(result, result.toBuilder().chunkId("c2").build()));

        String block = "\n<document>\nChapter 4 > Firewalls\n\nText:\nA stateful firewall tracks connections."
                + "\n\nSummary:\nStateful firewalls.\n</document>\n";
        assertThat(context).isEqualTo(block + block);
    }

    @Test
    @DisplayName("Should produce an empty context for no results")
    void assemble_ShouldBeEmptyForNoResults() {
        assertThat(ContextAssembler.assemble(List.of())).isEmpty();
        assertThat(ContextAssembler.parse("")).isEmpty();
    }

    @Test
    @DisplayName("Should recover header, content and summary of every block in order")
    void parse_ShouldRoundTrip() {
        List<SearchResult> results = List.of(
                result("Domain 1 > Controls", "Line one\nLine two\n\nNew paragraph.", "Controls overview."),
                result("Domain 2 > Threats", "Threat actors include insiders.", ""),
                result("Domain 3 > Architecture", "Zero trust assumes breach.", "Zero trust."));

        List<ContextBlock> blocks = ContextAssembler.parse(ContextAssembler.assemble(results));

        assertThat(blocks).containsExactly(
                new ContextBlock("Domain 1 > Controls", "Line one\nLine two\n\nNew paragraph.", "Controls overview."),
                new ContextBlock("Domain 2 > Threats", "Threat actors include insiders.", ""),
                new ContextBlock("Domain 3 > Architecture", "Zero trust assumes breach.", "Zero trust."));
    }

    @Test
    @DisplayName("Should split on the first Text and last Summary separators of a block")
    void parse_ShouldResolveEmbeddedSeparators() {
        // separators inside a header or summary move text into the content field
        String context = ContextAssembler.assemble(List.of(
                result("Ports\n\nText:\nTable", "22 is SSH.", "Ports."),
                result("Hashing", "SHA-256 digests.", "Old\n\nSummary:\nNew")));

        List<ContextBlock> blocks = ContextAssembler.parse(context);

        assertThat(blocks).containsExactly(
                new ContextBlock("Ports", "Table\n\nText:\n22 is SSH.", "Ports."),
                new ContextBlock("Hashing", "SHA-256 digests.\n\nSummary:\nOld", "New"));
    }

    @Test
    @DisplayName("Should reject text that is not an assembled context")
    void parse_ShouldRejectForeignText() {
        assertThatThrownBy(() -> ContextAssembler.parse("just some text"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static SearchResult result(String header, String content, String summary) {
        return SearchResult.builder()
                .chunkId(header)
                .sectionHeader(header)
                .content(content)
                .summary(summary)
                .metadata(Map.of())
                .score(0.5)
                .build();
    }
}
