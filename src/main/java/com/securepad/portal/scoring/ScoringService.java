package com.securepad.portal.scoring;

import com.securepad.portal.assessment.AssessmentModels.Question;
import com.securepad.portal.scoring.ScoringModels.QuestionScore;
import com.securepad.portal.scoring.ScoringModels.ScoreReport;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Scores multiple-choice answers. A question earns 100 only when the selected options are
 * exactly the correct ones, otherwise 0. Descriptive questions are graded by hand and never
 * appear here.
 */
@Service
public class ScoringService {
    static final int FULL_CREDIT = 100;

    public ScoreReport score(List<Question> questions, Map<String, Set<String>> responses) {
        Map<String, Set<String>> answers = responses == null ? Map.of() : responses;

        List<QuestionScore> scored = new ArrayList<>();
        for (int i = 0; i < questions.size(); i++) {
            Question q = questions.get(i);
            if (!q.multipleChoice()) continue;
            String key = String.valueOf(i);
            Set<String> selected = Optional.ofNullable(answers.get(key)).orElse(Set.of()).stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            boolean correct = isExactMatch(q.correctOptionTexts(), selected);
            scored.add(new QuestionScore(key, q.categoryName(), selected, correct, correct ? FULL_CREDIT : 0));
        }

        Map<String, List<QuestionScore>> byCategory = scored.stream()
                .filter(s -> s.categoryName() != null && !s.categoryName().isBlank())
                .collect(Collectors.groupingBy(QuestionScore::categoryName, LinkedHashMap::new, Collectors.toList()));

        Map<String, Double> categoryScores = new LinkedHashMap<>();
        byCategory.forEach((category, rows) -> categoryScores.put(category, mean(rows)));

        Double objective = scored.isEmpty() ? null : mean(scored);
        return new ScoreReport(scored, categoryScores, objective);
    }

    public boolean isExactMatch(Set<String> correct, Set<String> selected) {
        return correct.equals(selected);
    }

    private double mean(List<QuestionScore> rows) {
        double avg = rows.stream().mapToInt(QuestionScore::score).average().orElse(0.0);
        return BigDecimal.valueOf(avg).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
