package com.securepad.portal.validation;

import com.securepad.portal.assessment.AssessmentModels.Question;
import com.securepad.portal.assessment.AssessmentModels.QuestionOption;
import com.securepad.portal.assessment.AssessmentModels.QuestionType;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Collects every problem in an assessment definition instead of stopping at the first one.
 * Issues are prefixed with the zero-based question index they belong to.
 */
@Component
public class AssessmentDraftValidator {
    public List<String> validate(String title, String description, List<Question> questions, Integer timeLimit) {
        List<String> issues = new ArrayList<>();
        if (title == null || title.isBlank()) issues.add("Assessment title is required");
        if (description == null || description.isBlank()) issues.add("Assessment description is required");
        if (timeLimit != null && timeLimit <= 0) issues.add("Time limit must be a positive number of minutes");
        if (questions == null || questions.isEmpty()) {
            issues.add("At least one question is required");
            return issues;
        }

        for (int i = 0; i < questions.size(); i++) {
            Question q = questions.get(i);
            String at = "question " + i + ": ";
            if (q == null) {
                issues.add(at + "missing");
                continue;
            }
            if (q.questionText() == null || q.questionText().isBlank()) issues.add(at + "text is required");
            if (q.maxPoints() != null && q.maxPoints() < 0) issues.add(at + "max points must not be negative");

            List<QuestionOption> options = q.options() == null ? List.of() : q.options();
            if (q.type() == QuestionType.MCQ) {
                validateOptions(at, options, issues);
            } else if (!options.isEmpty()) {
                issues.add(at + "only multiple-choice questions may have options");
            }
        }
        return issues;
    }

    private void validateOptions(String at, List<QuestionOption> options, List<String> issues) {
        if (options.size() < 2) {
            issues.add(at + "multiple-choice questions need at least two options");
        }
        if (options.stream().anyMatch(o -> o == null || o.text() == null || o.text().isBlank())) {
            issues.add(at + "option text is required");
            return;
        }
        Map<String, Long> counts = options.stream().collect(Collectors.groupingBy(QuestionOption::text, Collectors.counting()));
        counts.forEach((text, count) -> {
            if (count > 1) issues.add(at + "duplicate option: " + text);
        });
        if (options.stream().noneMatch(QuestionOption::correct)) {
            issues.add(at + "at least one option must be marked correct");
        }
    }
}
