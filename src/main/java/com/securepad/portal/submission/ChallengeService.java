package com.securepad.portal.submission;

import com.securepad.portal.error.*;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.repository.SubmissionJdbcRepository;
import com.securepad.portal.submission.SubmissionModels.ChallengeStatus;
import com.securepad.portal.submission.SubmissionModels.EvaluationStatus;
import com.securepad.portal.submission.SubmissionModels.Submission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Grade challenges: a student files at most one per submission once it is evaluated, and
 * admins respond until it reaches ACCEPTED, REJECTED or RESOLVED. Accepting a challenge does
 * not change the grade; the admin re-evaluates separately.
 */
@Service
public class ChallengeService {
    private static final Logger log = LoggerFactory.getLogger(ChallengeService.class);

    private final SubmissionJdbcRepository repository;
    private final SubmissionService submissionService;
    private final Clock clock;

    public ChallengeService(SubmissionJdbcRepository repository, SubmissionService submissionService, Clock clock) {
        this.repository = repository;
        this.submissionService = submissionService;
        this.clock = clock;
    }

    public Submission fileChallenge(Principal principal, String submissionId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Please provide a reason for the challenge");
        }
        Submission submission = submissionService.require(submissionId);
        if (!submission.userId().equals(principal.id())) {
            throw new AuthorizationException("Not authorized to challenge this submission");
        }

        int updated = repository.openChallenge(submissionId, principal.id(), reason, Instant.now(clock));
        if (updated == 0) {
            Submission current = submissionService.require(submissionId);
            if (current.evaluationStatus() != EvaluationStatus.EVALUATED) {
                throw new ValidationException("Only evaluated submissions can be challenged");
            }
            throw new AlreadyChallengedException("This submission already has a challenge");
        }
        log.info("Challenge filed on submission {} by {}", submissionId, principal.id());
        return submissionService.require(submissionId);
    }

    public Submission respondToChallenge(Principal principal, String submissionId, String response) {
        return respondToChallenge(principal, submissionId, response, null);
    }

    /**
     * Applies an admin response. The outcome is {@code status} when given, otherwise the tag
     * embedded in {@code response}. The response text is stored verbatim.
     */
    public Submission respondToChallenge(Principal principal, String submissionId, String response, ChallengeStatus status) {
        if (!principal.isAdmin()) {
            throw new AuthorizationException("Not authorized to respond to challenges");
        }
        if (response == null || response.isBlank()) {
            throw new ValidationException("Please provide a response to the challenge");
        }
        if (status == ChallengeStatus.PENDING) {
            throw new ValidationException("A response cannot move a challenge back to pending");
        }
        submissionService.require(submissionId);

        ChallengeStatus outcome = status != null ? status : ChallengeResponseTags.outcomeOf(response);
        Instant resolvedDate = outcome.isOpen() ? null : Instant.now(clock);
        int updated = repository.recordChallengeResponse(submissionId, outcome, response, resolvedDate);
        if (updated == 0) {
            throw new NoPendingChallengeException("This submission does not have a pending or reviewing challenge");
        }
        log.info("Challenge on submission {} moved to {} by {}", submissionId, outcome, principal.id());
        return submissionService.require(submissionId);
    }
}
