package com.securepad.portal.submission;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.securepad.portal.assessment.AssessmentModels.AssessmentPayload;
import com.securepad.portal.assessment.AssessmentModels.AssessmentRef;
import com.securepad.portal.identity.IdentityModels.UserRef;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

public class SubmissionModels {
    public enum EvaluationStatus { PENDING, EVALUATED }

    public enum ChallengeStatus {
        PENDING, REVIEWING, ACCEPTED, REJECTED, RESOLVED;

        public boolean isOpen() {
            return this == PENDING || this == REVIEWING;
        }
    }

    public enum SubmissionFilter { ALL, PENDING_EVALUATION, OPEN_CHALLENGE }

    public record Challenge(ChallengeStatus status,
                            String reason,
                            String adminResponse,
                            Instant challengeDate,
                            Instant resolvedDate) {}

    /**
     * One student's answers to one assessment. grade, feedback and evaluatedAt are null while
     * the submission is PENDING; challenge stays null until the student files one.
     */
    public record Submission(String id,
                             String userId,
                             String assessmentId,
                             String content,
                             Map<String, Set<String>> mcqResponses,
                             int tabSwitches,
                             Instant submittedAt,
                             EvaluationStatus evaluationStatus,
                             Integer grade,
                             String feedback,
                             Instant evaluatedAt,
                             Map<String, Double> categoryScores,
                             Map<String, String> evaluatorNotes,
                             Challenge challenge) {}

    public record SubmissionRequest(String assessmentId,
                                    String content,
                                    Integer tabSwitches,
                                    @JsonAlias("multipleChoiceAnswers") Map<String, Set<String>> mcqResponses) {}

    public record SubmissionUpdate(String content, Integer tabSwitches) {}

    public record EvaluationRequest(BigDecimal grade, String feedback, Map<String, String> evaluatorNotes) {}

    public record ChallengeRequest(String reason) {}

    public record ChallengeResponseRequest(String response, ChallengeStatus status) {}

    public record SubmissionListing(Submission submission, AssessmentRef assessment, UserRef user) {}

    public record SubmissionDetail(Submission submission, AssessmentPayload assessment, UserRef user) {}
}
