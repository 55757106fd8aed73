package com.securepad.portal;

import com.securepad.portal.assessment.AssessmentModels.Question;
import com.securepad.portal.assessment.AssessmentModels.QuestionOption;
import com.securepad.portal.assessment.AssessmentModels.QuestionType;
import com.securepad.portal.scoring.ScoringModels.ScoreReport;
import com.securepad.portal.scoring.ScoringService;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScoringServiceTest {
    private final ScoringService scoring = new ScoringService();

    private static Question mcq(String category, String... correctThenWrong) {
        // options named "*X" are correct
        List<QuestionOption> options = java.util.Arrays.stream(correctThenWrong)
                .map(o -> o.startsWith("*") ? new QuestionOption(o.substring(1), true) : new QuestionOption(o, false))
                .toList();
        return new Question("q", "", 10, category, QuestionType.MCQ, options);
    }

    @Test
    void requiresExactSetOfCorrectOptions() {
        List<Question> questions = List.of(mcq("Letters", "*A", "B", "*C"));

        assertEquals(100, scoring.score(questions, Map.of("0", Set.of("A", "C"))).questions().get(0).score());
        assertEquals(0, scoring.score(questions, Map.of("0", Set.of("A"))).questions().get(0).score());
        assertEquals(0, scoring.score(questions, Map.of("0", Set.of("A", "B", "C"))).questions().get(0).score());
        assertEquals(0, scoring.score(questions, Map.of("0", Set.of())).questions().get(0).score());
        assertEquals(0, scoring.score(questions, Map.of()).questions().get(0).score());
    }

    @Test
    void averagesQuestionScoresPerCategory() {
        List<Question> questions = List.of(
                mcq("Geography", "*Paris", "Lyon"),
                mcq("Geography", "*Nile", "Thames"),
                mcq("Letters", "*A", "B"));

        ScoreReport report = scoring.score(questions, Map.of(
                "0", Set.of("Paris"),
                "1", Set.of("Thames"),
                "2", Set.of("A")));

        assertEquals(50.0, report.categoryScores().get("Geography"));
        assertEquals(100.0, report.categoryScores().get("Letters"));
        assertEquals(66.67, report.objectiveScore());
    }

    @Test
    void leavesOutUncategorisedAndDescriptiveQuestions() {
        List<Question> questions = List.of(
                new Question("essay", "", 20, "Writing", QuestionType.DESCRIPTIVE, List.of()),
                mcq(null, "*4", "5"),
                mcq("  ", "*yes", "no"));

        ScoreReport report = scoring.score(questions, Map.of("1", Set.of("4")));

        assertTrue(report.categoryScores().isEmpty());
        assertEquals(2, report.questions().size());
        assertEquals("1", report.questions().get(0).questionIndex());
        assertEquals(50.0, report.objectiveScore());
    }

    @Test
    void roundsCategoryPercentagesToTwoDecimals() {
        List<Question> questions = List.of(mcq("Logic", "*T", "F"), mcq("Logic", "*T", "F"), mcq("Logic", "*T", "F"));

        ScoreReport report = scoring.score(questions, Map.of("0", Set.of("T")));

        assertEquals(33.33, report.categoryScores().get("Logic"));
    }

    @Test
    void hasNoObjectiveScoreWithoutMultipleChoiceQuestions() {
        ScoreReport report = scoring.score(
                List.of(new Question("essay", "", 10, null, QuestionType.DESCRIPTIVE, List.of())),
                null);

        assertNull(report.objectiveScore());
        assertTrue(report.questions().isEmpty());
    }
}
