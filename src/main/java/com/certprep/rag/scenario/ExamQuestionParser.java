package com.certprep.rag.scenario;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses practice-exam questions pasted as plain text.
 *
 * <p>Two layouts are recognised. Labeled:
 * <pre>
 * A company stores customer records on ...
 * Which of the following should the analyst do first?
 * A. Isolate the host
 * B. Reimage the host
 * Correct answer: A
 * The host must be contained before ...
 * </pre>
 * and unlabeled, where a line reading {@code answer} introduces one option per line.
 * Lines before the first one ending in {@code ?} are the scenario.
 */
@Slf4j
public final class ExamQuestionParser {

    private static final Pattern LABELED_OPTION = Pattern.compile("^([A-D]|[1-4])\\.\\s*(.+)$");
    private static final Pattern ANSWER_LINE =
            Pattern.compile("^(?:Correct answer|Answer):\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    private enum Section { SCENARIO, QUESTION, OPTIONS, EXPLANATION }

    private ExamQuestionParser() {
    }

    public static ExamQuestion parse(String text, String id) {
        List<String> scenarioLines = new ArrayList<>();
        List<String> questionLines = new ArrayList<>();
        List<String> options = new ArrayList<>();
        List<String> explanationLines = new ArrayList<>();
        String correctAnswer = null;

        Section section = Section.SCENARIO;
        boolean unlabeled = false;

        for (String raw : text.strip().split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }

            Matcher option = LABELED_OPTION.matcher(line);
            if (option.matches() && (section == Section.QUESTION || section == Section.OPTIONS)) {
                section = Section.OPTIONS;
                unlabeled = false;
                options.add(option.group(2));
                continue;
            }

            Matcher answer = ANSWER_LINE.matcher(line);
            if (answer.matches()) {
                section = Section.EXPLANATION;
                correctAnswer = answer.group(1).strip();
                continue;
            }

            if (line.equalsIgnoreCase("answer") && section == Section.QUESTION) {
                section = Section.OPTIONS;
                unlabeled = true;
                continue;
            }

            switch (section) {
                case SCENARIO -> {
                    if (line.endsWith("?")) {
                        section = Section.QUESTION;
                        questionLines.add(line);
                    } else {
                        scenarioLines.add(line);
                    }
                }
                case QUESTION -> questionLines.add(line);
                case OPTIONS -> {
                    if (unlabeled) {
                        options.add(line);
                    }
                }
                case EXPLANATION -> explanationLines.add(line);
            }
        }

        String scenario = String.join(" ", scenarioLines);
        String question = String.join(" ", questionLines);
        if (question.isEmpty() && !scenario.isEmpty()) {
            // no line ended with '?': treat the whole text as the question
            log.debug("Question {} has no interrogative line, using full text as question", id);
            question = scenario;
            scenario = "";
        }

        return ExamQuestion.builder()
                .id(id == null ? "unknown" : id)
                .scenario(scenario)
                .question(question)
                .options(options)
                .correctAnswer(correctAnswer)
                .explanation(explanationLines.isEmpty() ? null : String.join(" ", explanationLines))
                .build();
    }
}
