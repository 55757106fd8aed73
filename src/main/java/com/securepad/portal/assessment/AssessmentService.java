package com.securepad.portal.assessment;

import com.securepad.portal.assessment.AssessmentModels.*;
import com.securepad.portal.error.AssessmentLockedException;
import com.securepad.portal.error.AuthorizationException;
import com.securepad.portal.error.NotFoundException;
import com.securepad.portal.error.ValidationException;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.repository.AssessmentJdbcRepository;
import com.securepad.portal.repository.RecordIds;
import com.securepad.portal.repository.SubmissionJdbcRepository;
import com.securepad.portal.validation.AssessmentDraftValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Authoring and read access for assessments. Once a submission references an assessment its
 * question list can no longer change and the assessment can no longer be deleted.
 */
@Service
public class AssessmentService {
    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);
    private static final String QUESTIONS_LOCKED = "Cannot modify questions for an assessment that already has submissions";

    private final AssessmentJdbcRepository repository;
    private final SubmissionJdbcRepository submissions;
    private final AssessmentDraftValidator validator;
    private final Clock clock;
    private final int defaultTimeLimit;
    private final int defaultMaxPoints;

    public AssessmentService(AssessmentJdbcRepository repository,
                             SubmissionJdbcRepository submissions,
                             AssessmentDraftValidator validator,
                             Clock clock,
                             @Value("${portal.assessment.default-time-limit-minutes:60}") int defaultTimeLimit,
                             @Value("${portal.assessment.default-max-points:10}") int defaultMaxPoints) {
        this.repository = repository;
        this.submissions = submissions;
        this.validator = validator;
        this.clock = clock;
        this.defaultTimeLimit = defaultTimeLimit;
        this.defaultMaxPoints = defaultMaxPoints;
    }

    public Assessment create(Principal principal, AssessmentDraft draft) {
        requireAdmin(principal, "Not authorized to create assessments");
        if (draft == null) throw new ValidationException("Please provide all required fields");
        List<String> issues = validator.validate(draft.title(), draft.description(), draft.questions(), draft.timeLimit());
        if (!issues.isEmpty()) {
            throw new ValidationException("Please provide all required fields", issues);
        }
        Assessment assessment = new Assessment(
                RecordIds.newId(),
                draft.title().trim(),
                draft.description(),
                principal.id(),
                true,
                draft.timeLimit() == null ? defaultTimeLimit : draft.timeLimit(),
                normalize(draft.questions()),
                Instant.now(clock));
        repository.insert(assessment);
        log.info("Assessment {} created by {} with {} questions", assessment.id(), principal.id(), assessment.questions().size());
        return assessment;
    }

    public Optional<Assessment> findById(String id) {
        if (!RecordIds.isWellFormed(id)) return Optional.empty();
        return repository.findById(id);
    }

    public Assessment getById(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Assessment not found"));
    }

    public List<Assessment> list(boolean activeOnly) {
        return repository.findAll(activeOnly).stream()
                .sorted(Comparator.comparing(Assessment::createdAt).reversed())
                .toList();
    }

    /** Admins see every assessment in full; students see active ones without answer keys. */
    public List<AssessmentPayload> listFor(Principal principal) {
        if (principal.isAdmin()) {
            return new ArrayList<>(list(false));
        }
        return list(true).stream().map(this::studentView).map(AssessmentPayload.class::cast).toList();
    }

    public AssessmentPayload getFor(Principal principal, String id) {
        Assessment assessment = getById(id);
        if (principal.isAdmin()) {
            return assessment;
        }
        if (!assessment.active()) {
            throw new AuthorizationException("Not authorized to access this assessment");
        }
        return studentView(assessment);
    }

    public Assessment update(Principal principal, String id, AssessmentUpdate update) {
        requireAdmin(principal, "Not authorized to update this assessment");
        Assessment current = getById(id);
        if (update == null) return current;
        if (update.questions() != null && questionsLocked(id)) {
            throw new AssessmentLockedException(QUESTIONS_LOCKED);
        }

        String title = isBlank(update.title()) ? current.title() : update.title().trim();
        String description = isBlank(update.description()) ? current.description() : update.description();
        List<Question> questions = update.questions() == null ? current.questions() : update.questions();
        Integer timeLimit = update.timeLimit() == null ? current.timeLimit() : update.timeLimit();
        List<String> issues = validator.validate(title, description, questions, timeLimit);
        if (!issues.isEmpty()) {
            throw new ValidationException("Invalid assessment update", issues);
        }

        Assessment updated = new Assessment(current.id(), title, description, current.createdBy(),
                update.active() == null ? current.active() : update.active(),
                timeLimit, update.questions() == null ? current.questions() : normalize(questions),
                current.createdAt());
        if (update.questions() == null) {
            repository.update(updated);
        } else if (repository.updateUnlessSubmitted(updated) == 0) {
            throw new AssessmentLockedException(QUESTIONS_LOCKED);
        }
        log.info("Assessment {} updated by {}", id, principal.id());
        return updated;
    }

    public Assessment setActive(Principal principal, String id, boolean active) {
        requireAdmin(principal, active ? "Not authorized to activate this assessment" : "Not authorized to deactivate this assessment");
        getById(id);
        repository.setActive(id, active);
        log.info("Assessment {} {} by {}", id, active ? "activated" : "deactivated", principal.id());
        return getById(id);
    }

    public void delete(Principal principal, String id) {
        requireAdmin(principal, "Not authorized to delete this assessment");
        getById(id);
        if (questionsLocked(id) || repository.deleteUnlessSubmitted(id) == 0) {
            throw new AssessmentLockedException("Cannot delete an assessment that already has submissions");
        }
        log.info("Assessment {} deleted by {}", id, principal.id());
    }

    public boolean questionsLocked(String id) {
        return submissions.existsForAssessment(id);
    }

    public Map<String, AssessmentRef> refs(Collection<String> ids) {
        Map<String, AssessmentRef> refs = new HashMap<>();
        for (String id : new HashSet<>(ids)) {
            findById(id).ifPresent(a -> refs.put(id, new AssessmentRef(a.id(), a.title(), a.description())));
        }
        return refs;
    }

    public StudentAssessmentView studentView(Assessment assessment) {
        List<StudentQuestion> questions = assessment.questions().stream()
                .map(q -> new StudentQuestion(
                        q.questionText(),
                        q.instructions(),
                        q.maxPoints(),
                        q.categoryName(),
                        q.type(),
                        q.multipleChoice() ? q.options().stream().map(QuestionOption::text).toList() : List.of(),
                        q.multipleChoice() ? selectionMode(q) : null))
                .toList();
        return new StudentAssessmentView(assessment.id(), assessment.title(), assessment.description(),
                assessment.timeLimit(), questions);
    }

    private SelectionMode selectionMode(Question q) {
        return q.correctOptionTexts().size() == 1 ? SelectionMode.SINGLE : SelectionMode.MULTIPLE;
    }

    private List<Question> normalize(List<Question> questions) {
        return questions.stream()
                .map(q -> new Question(
                        q.questionText().trim(),
                        q.instructions() == null ? "" : q.instructions(),
                        q.maxPoints() == null ? defaultMaxPoints : q.maxPoints(),
                        isBlank(q.categoryName()) ? null : q.categoryName().trim(),
                        q.type() == null ? QuestionType.DESCRIPTIVE : q.type(),
                        q.options() == null ? List.of() : List.copyOf(q.options())))
                .toList();
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
