package com.certprep.rag.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class JudgeRequest {

    String prompt;

    /**
     * Calling component, for log correlation and usage accounting.
     */
    String purpose;

    @Builder.Default
    int maxOutputTokens = 50;

    @Singular
    List<String> stopSequences;
}
