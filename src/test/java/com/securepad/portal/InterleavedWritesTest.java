package com.securepad.portal;

import com.securepad.portal.assessment.AssessmentModels.Assessment;
import com.securepad.portal.assessment.AssessmentModels.AssessmentUpdate;
import com.securepad.portal.assessment.AssessmentModels.Question;
import com.securepad.portal.assessment.AssessmentModels.QuestionType;
import com.securepad.portal.assessment.AssessmentService;
import com.securepad.portal.error.AssessmentLockedException;
import com.securepad.portal.error.NotFoundException;
import com.securepad.portal.error.ValidationException;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.identity.IdentityService;
import com.securepad.portal.repository.AssessmentJdbcRepository;
import com.securepad.portal.repository.SubmissionJdbcRepository;
import com.securepad.portal.submission.SubmissionModels.EvaluationStatus;
import com.securepad.portal.submission.SubmissionModels.Submission;
import com.securepad.portal.submission.SubmissionModels.SubmissionUpdate;
import com.securepad.portal.submission.SubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.doAnswer;

/**
 * Runs a competing write in the gap between a service's read and its own write, and checks
 * that the storage condition still decides the outcome.
 */
@SpringBootTest
class InterleavedWritesTest {
    @SpyBean
    SubmissionJdbcRepository submissionRepository;
    @SpyBean
    AssessmentJdbcRepository assessmentRepository;
    @Autowired
    SubmissionService submissionService;
    @Autowired
    AssessmentService assessmentService;
    @Autowired
    IdentityService identityService;
    @Autowired
    JdbcTemplate jdbcTemplate;

    PortalFixtures fixtures;
    Principal admin;
    Principal student;

    @BeforeEach
    void setUp() {
        fixtures = new PortalFixtures(identityService, assessmentService);
        admin = fixtures.admin();
        student = fixtures.student();
    }

    @Test
    void studentUpdateLosesToEvaluationThatLandsFirst() {
        Assessment assessment = fixtures.descriptiveAssessment(admin);
        Submission submission = submissionService.createSubmission(student, assessment.id(), "original", 1, null);
        doAnswer(invocation -> {
            submissionService.evaluate(admin, submission.id(), 90, "Graded meanwhile");
            return invocation.callRealMethod();
        }).when(submissionRepository).updateAnswers(eq(submission.id()), anyString(), anyInt(), anyBoolean());

        assertThrows(ValidationException.class, () -> submissionService.update(student, submission.id(),
                new SubmissionUpdate("rewritten after grading", 9)));

        Submission stored = submissionService.require(submission.id());
        assertEquals(EvaluationStatus.EVALUATED, stored.evaluationStatus());
        assertEquals(90, stored.grade());
        assertEquals("original", stored.content());
        assertEquals(1, stored.tabSwitches());
    }

    @Test
    void questionEditLosesToSubmissionThatLandsFirst() {
        Assessment assessment = fixtures.descriptiveAssessment(admin);
        List<Question> replacement = List.of(new Question("Replaced", null, 5, null, QuestionType.DESCRIPTIVE, null));
        doAnswer(invocation -> {
            submissionService.createSubmission(student, assessment.id(), "answer", 0, null);
            return invocation.callRealMethod();
        }).when(assessmentRepository).updateUnlessSubmitted(argThat(a -> a.id().equals(assessment.id())));

        assertThrows(AssessmentLockedException.class, () -> assessmentService.update(admin, assessment.id(),
                new AssessmentUpdate(null, null, replacement, null, null)));

        assertTrue(assessmentService.questionsLocked(assessment.id()));
        assertEquals("Explain recursion", assessmentService.getById(assessment.id()).questions().get(0).questionText());
    }

    @Test
    void deleteLosesToSubmissionThatLandsFirst() {
        Assessment assessment = fixtures.descriptiveAssessment(admin);
        doAnswer(invocation -> {
            submissionService.createSubmission(student, assessment.id(), "answer", 0, null);
            return invocation.callRealMethod();
        }).when(assessmentRepository).deleteUnlessSubmitted(assessment.id());

        assertThrows(AssessmentLockedException.class, () -> assessmentService.delete(admin, assessment.id()));

        assertNotNull(assessmentService.getById(assessment.id()));
    }

    @Test
    void submittingToAnAssessmentDeletedMidwayReportsNotFound() {
        Assessment assessment = fixtures.descriptiveAssessment(admin);
        doAnswer(invocation -> {
            jdbcTemplate.update("DELETE FROM assessments WHERE id=?", assessment.id());
            return invocation.callRealMethod();
        }).when(submissionRepository).insert(argThat(s -> s.assessmentId().equals(assessment.id())));

        NotFoundException error = assertThrows(NotFoundException.class,
                () -> submissionService.createSubmission(student, assessment.id(), "answer", 0, null));

        assertEquals("Assessment not found", error.getMessage());
    }
}
