package com.securepad.portal.scoring;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class ScoringModels {
    public record QuestionScore(String questionIndex, String categoryName, Set<String> selected, boolean correct, int score) {}

    /**
     * Objective part of a submission. {@code objectiveScore} is null when the assessment has no
     * multiple-choice questions.
     */
    public record ScoreReport(List<QuestionScore> questions, Map<String, Double> categoryScores, Double objectiveScore) {}
}
