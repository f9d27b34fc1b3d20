package com.certprep.rag.scenario;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A practice-exam question. Options are kept in presentation order without letters;
 * mapping them to A-D is up to the caller.
 */
@Value
@Builder
public class ExamQuestion {

    String id;
    String scenario;
    String question;

    @Singular
    List<String> options;

    /**
     * Letter or option text as given in the source; never used for retrieval.
     */
    String correctAnswer;

    String explanation;

    /**
     * Chapter the question belongs to, when known.
     */
    String chapter;
}
