package com.securepad.portal.submission;

import com.securepad.portal.assessment.AssessmentModels.Assessment;
import com.securepad.portal.assessment.AssessmentModels.AssessmentPayload;
import com.securepad.portal.assessment.AssessmentModels.AssessmentRef;
import com.securepad.portal.assessment.AssessmentService;
import com.securepad.portal.error.*;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.identity.IdentityModels.UserRef;
import com.securepad.portal.identity.IdentityService;
import com.securepad.portal.repository.RecordIds;
import com.securepad.portal.repository.SubmissionJdbcRepository;
import com.securepad.portal.scoring.ScoringModels.ScoreReport;
import com.securepad.portal.scoring.ScoringService;
import com.securepad.portal.submission.SubmissionModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);
    private static final String EVALUATED_IS_FINAL = "Cannot update an evaluated submission";

    private final SubmissionJdbcRepository repository;
    private final AssessmentService assessmentService;
    private final ScoringService scoringService;
    private final IdentityService identityService;
    private final Clock clock;

    public SubmissionService(SubmissionJdbcRepository repository,
                             AssessmentService assessmentService,
                             ScoringService scoringService,
                             IdentityService identityService,
                             Clock clock) {
        this.repository = repository;
        this.assessmentService = assessmentService;
        this.scoringService = scoringService;
        this.identityService = identityService;
        this.clock = clock;
    }

    public Submission createSubmission(Principal principal, SubmissionRequest request) {
        if (request == null) throw new ValidationException("Please provide all required fields");
        return createSubmission(principal, request.assessmentId(), request.content(), request.tabSwitches(), request.mcqResponses());
    }

    /**
     * Stores the caller's single submission for an assessment. The lookup before the insert
     * only produces a friendlier early error; the UNIQUE constraint on (user, assessment)
     * decides concurrent attempts.
     */
    public Submission createSubmission(Principal principal,
                                       String assessmentId,
                                       String content,
                                       Integer tabSwitches,
                                       Map<String, Set<String>> mcqResponses) {
        if (isBlank(assessmentId) || isBlank(content)) {
            throw new ValidationException("Please provide all required fields");
        }
        if (tabSwitches != null && tabSwitches < 0) {
            throw new ValidationException("Tab switch count must not be negative");
        }

        Assessment assessment = assessmentService.getById(assessmentId);
        if (!assessment.active() && !principal.isAdmin()) {
            throw new InactiveAssessmentException("This assessment is no longer active");
        }
        if (repository.findByUserAndAssessment(principal.id(), assessmentId).isPresent()) {
            throw new DuplicateSubmissionException();
        }

        Submission submission = new Submission(
                RecordIds.newId(), principal.id(), assessmentId, content,
                normalizeResponses(mcqResponses),
                tabSwitches == null ? 0 : tabSwitches,
                Instant.now(clock), EvaluationStatus.PENDING,
                null, null, null, Map.of(), Map.of(), null);
        try {
            repository.insert(submission);
        } catch (DuplicateKeyException e) {
            log.warn("Concurrent duplicate submission rejected by storage for user {} on assessment {}", principal.id(), assessmentId);
            throw new DuplicateSubmissionException();
        } catch (DataAccessException e) {
            if (repository.findByUserAndAssessment(principal.id(), assessmentId).isPresent()) {
                log.warn("Submission insert for user {} on assessment {} lost a race: {}", principal.id(), assessmentId, e.getMessage());
                throw new DuplicateSubmissionException();
            }
            if (e instanceof DataIntegrityViolationException && assessmentService.findById(assessmentId).isEmpty()) {
                log.warn("Assessment {} was deleted while user {} was submitting", assessmentId, principal.id());
                throw new NotFoundException("Assessment not found");
            }
            throw e;
        }
        log.info("Submission {} created by {} for assessment {} (tabSwitches={})",
                submission.id(), principal.id(), assessmentId, submission.tabSwitches());
        return submission;
    }

    public List<SubmissionListing> listMine(Principal principal) {
        return listings(repository.findByUser(principal.id()), false);
    }

    public List<SubmissionListing> listAll(Principal principal, SubmissionFilter filter) {
        requireAdmin(principal, "Not authorized to access all submissions");
        return listings(repository.findAll().stream().filter(matcher(filter)).toList(), true);
    }

    private Predicate<Submission> matcher(SubmissionFilter filter) {
        if (filter == SubmissionFilter.PENDING_EVALUATION) {
            return s -> s.evaluationStatus() == EvaluationStatus.PENDING;
        }
        if (filter == SubmissionFilter.OPEN_CHALLENGE) {
            return s -> s.challenge() != null && s.challenge().status().isOpen();
        }
        return s -> true;
    }

    public List<SubmissionListing> listForAssessment(Principal principal, String assessmentId) {
        requireAdmin(principal, "Not authorized to access assessment submissions");
        Assessment assessment = assessmentService.getById(assessmentId);
        return listings(repository.findByAssessment(assessment.id()), true);
    }

    public SubmissionDetail getById(Principal principal, String id) {
        Submission submission = require(id);
        if (!principal.isAdmin() && !submission.userId().equals(principal.id())) {
            throw new AuthorizationException("Not authorized to view this submission");
        }
        Assessment assessment = assessmentService.getById(submission.assessmentId());
        AssessmentPayload payload = principal.isAdmin() ? assessment : assessmentService.studentView(assessment);
        UserRef user = identityService.userRefs(List.of(submission.userId())).get(submission.userId());
        return new SubmissionDetail(submission, payload, user);
    }

    public Submission update(Principal principal, String id, SubmissionUpdate update) {
        Submission submission = require(id);
        if (!submission.userId().equals(principal.id()) && !principal.isAdmin()) {
            throw new AuthorizationException("Not authorized to update this submission");
        }
        if (submission.evaluationStatus() == EvaluationStatus.EVALUATED && !principal.isAdmin()) {
            throw new ValidationException(EVALUATED_IS_FINAL);
        }
        if (update == null) return submission;
        if (update.tabSwitches() != null && update.tabSwitches() < 0) {
            throw new ValidationException("Tab switch count must not be negative");
        }
        String content = isBlank(update.content()) ? submission.content() : update.content();
        int tabSwitches = update.tabSwitches() == null ? submission.tabSwitches() : update.tabSwitches();
        if (repository.updateAnswers(id, content, tabSwitches, !principal.isAdmin()) == 0) {
            // evaluated between the read above and this write
            throw new ValidationException(EVALUATED_IS_FINAL);
        }
        log.info("Submission {} updated by {}", id, principal.id());
        return require(id);
    }

    public Submission evaluate(Principal principal, String id, int grade, String feedback) {
        return evaluate(principal, id, BigDecimal.valueOf(grade), feedback, null);
    }

    /**
     * Records the admin's grade. Calling it again overwrites the previous evaluation; an
     * existing challenge is left exactly as it is.
     */
    public Submission evaluate(Principal principal, String id, BigDecimal grade, String feedback, Map<String, String> evaluatorNotes) {
        requireAdmin(principal, "Not authorized to evaluate submissions");
        if (grade == null || isBlank(feedback)) {
            throw new ValidationException("Please provide both grade and feedback");
        }
        int value = wholeGrade(grade);
        Submission submission = require(id);
        Assessment assessment = assessmentService.getById(submission.assessmentId());
        Map<String, String> notes = normalizeNotes(evaluatorNotes, assessment.questions().size());
        ScoreReport report = scoringService.score(assessment.questions(), submission.mcqResponses());

        repository.applyEvaluation(id, value, feedback, Instant.now(clock), report.categoryScores(), notes);
        log.info("Submission {} evaluated by {}: grade={}, categories={}", id, principal.id(), value, report.categoryScores().keySet());
        return require(id);
    }

    public Submission evaluate(Principal principal, String id, EvaluationRequest request) {
        if (request == null) throw new ValidationException("Please provide both grade and feedback");
        return evaluate(principal, id, request.grade(), request.feedback(), request.evaluatorNotes());
    }

    public ScoreReport previewScore(Principal principal, String id) {
        requireAdmin(principal, "Not authorized to score submissions");
        Submission submission = require(id);
        Assessment assessment = assessmentService.getById(submission.assessmentId());
        return scoringService.score(assessment.questions(), submission.mcqResponses());
    }

    public Submission require(String id) {
        if (!RecordIds.isWellFormed(id)) {
            throw new NotFoundException("Submission not found");
        }
        return repository.findById(id).orElseThrow(() -> new NotFoundException("Submission not found"));
    }

    private List<SubmissionListing> listings(List<Submission> rows, boolean withUsers) {
        List<Submission> sorted = rows.stream()
                .sorted(Comparator.comparing(Submission::submittedAt).reversed())
                .toList();
        Map<String, AssessmentRef> assessments = assessmentService.refs(sorted.stream().map(Submission::assessmentId).toList());
        Map<String, UserRef> users = withUsers
                ? identityService.userRefs(sorted.stream().map(Submission::userId).toList())
                : Map.of();
        return sorted.stream()
                .map(s -> new SubmissionListing(s, assessments.get(s.assessmentId()), users.get(s.userId())))
                .toList();
    }

    private int wholeGrade(BigDecimal grade) {
        BigDecimal stripped = grade.stripTrailingZeros();
        if (stripped.scale() > 0) {
            throw new ValidationException("Grade must be a whole number");
        }
        if (grade.compareTo(BigDecimal.ZERO) < 0 || grade.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new ValidationException("Grade must be between 0 and 100");
        }
        return grade.intValueExact();
    }

    private Map<String, String> normalizeNotes(Map<String, String> notes, int questionCount) {
        if (notes == null) return null;
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : notes.entrySet()) {
            if (!isQuestionIndex(e.getKey(), questionCount)) {
                throw new ValidationException("Evaluator note refers to unknown question: " + e.getKey());
            }
            if (!isBlank(e.getValue())) normalized.put(e.getKey(), e.getValue());
        }
        return normalized;
    }

    private boolean isQuestionIndex(String key, int questionCount) {
        if (key == null || key.isEmpty() || key.length() > 9) return false;
        if (!key.chars().allMatch(c -> c >= '0' && c <= '9')) return false;
        int index = Integer.parseInt(key);
        return index < questionCount;
    }

    private Map<String, Set<String>> normalizeResponses(Map<String, Set<String>> responses) {
        if (responses == null) return Map.of();
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        responses.forEach((question, selected) -> {
            if (question == null) return;
            copy.put(question, selected == null ? Set.of() : selected.stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        });
        return copy;
    }

    private static void requireAdmin(Principal principal, String message) {
        if (!principal.isAdmin()) {
            throw new AuthorizationException(message);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
