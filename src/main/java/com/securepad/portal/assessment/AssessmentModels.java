package com.securepad.portal.assessment;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class AssessmentModels {
    public enum QuestionType { DESCRIPTIVE, MCQ }

    public enum SelectionMode { SINGLE, MULTIPLE }

    /** Either the full assessment (admins) or the student view with correctness removed. */
    public interface AssessmentPayload {}

    public record QuestionOption(String text, @JsonProperty("isCorrect") boolean correct) {}

    public record Question(String questionText,
                           String instructions,
                           Integer maxPoints,
                           String categoryName,
                           QuestionType type,
                           List<QuestionOption> options) {
        public boolean multipleChoice() {
            return type == QuestionType.MCQ;
        }

        public Set<String> correctOptionTexts() {
            Set<String> correct = new LinkedHashSet<>();
            if (options != null) {
                options.stream().filter(QuestionOption::correct).forEach(o -> correct.add(o.text()));
            }
            return correct;
        }
    }

    public record Assessment(String id,
                             String title,
                             String description,
                             String createdBy,
                             @JsonProperty("isActive") boolean active,
                             int timeLimit,
                             List<Question> questions,
                             Instant createdAt) implements AssessmentPayload {}

    public record AssessmentDraft(String title, String description, List<Question> questions, Integer timeLimit) {}

    public record AssessmentUpdate(String title,
                                   String description,
                                   List<Question> questions,
                                   @JsonProperty("isActive") Boolean active,
                                   Integer timeLimit) {}

    public record StudentQuestion(String questionText,
                                  String instructions,
                                  Integer maxPoints,
                                  String categoryName,
                                  QuestionType type,
                                  List<String> options,
                                  SelectionMode selectionMode) {}

    public record StudentAssessmentView(String id,
                                        String title,
                                        String description,
                                        int timeLimit,
                                        List<StudentQuestion> questions) implements AssessmentPayload {}

    public record AssessmentRef(String id, String title, String description) {}
}
