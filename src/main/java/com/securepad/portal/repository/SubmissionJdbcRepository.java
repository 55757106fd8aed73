package com.securepad.portal.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securepad.portal.submission.SubmissionModels.Challenge;
import com.securepad.portal.submission.SubmissionModels.ChallengeStatus;
import com.securepad.portal.submission.SubmissionModels.EvaluationStatus;
import com.securepad.portal.submission.SubmissionModels.Submission;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Submissions live in a single row each. The (user_id, assessment_id) pair carries a UNIQUE
 * constraint, and evaluation and challenge writes are single conditional UPDATEs over
 * disjoint column sets, so each one is atomic for its row.
 */
@Repository
public class SubmissionJdbcRepository {
    private static final String COLUMNS = "id, user_id, assessment_id, content, mcq_responses, tab_switches, submitted_at, "
            + "evaluation_status, grade, feedback, evaluated_at, category_scores, evaluator_notes, "
            + "challenge_status, challenge_reason, challenge_admin_response, challenge_date, challenge_resolved_date";

    private static final TypeReference<Map<String, Set<String>>> RESPONSES = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> SCORES = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> NOTES = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Submission> mapper = this::mapRow;

    public SubmissionJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /** Throws {@link org.springframework.dao.DuplicateKeyException} when the pair already has a row. */
    public void insert(Submission s) {
        jdbcTemplate.update(
                "INSERT INTO submissions(id, user_id, assessment_id, content, mcq_responses, tab_switches, submitted_at, evaluation_status) VALUES (?,?,?,?,?,?,?,?)",
                s.id(), s.userId(), s.assessmentId(), s.content(), write(s.mcqResponses()),
                s.tabSwitches(), s.submittedAt().toString(), s.evaluationStatus().name());
    }

    public Optional<Submission> findById(String id) {
        return first(jdbcTemplate.query("SELECT " + COLUMNS + " FROM submissions WHERE id=?", mapper, id));
    }

    public Optional<Submission> findByUserAndAssessment(String userId, String assessmentId) {
        return first(jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM submissions WHERE user_id=? AND assessment_id=?", mapper, userId, assessmentId));
    }

    public List<Submission> findByUser(String userId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM submissions WHERE user_id=?", mapper, userId);
    }

    public List<Submission> findByAssessment(String assessmentId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM submissions WHERE assessment_id=?", mapper, assessmentId);
    }

    public List<Submission> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM submissions", mapper);
    }

    public boolean existsForAssessment(String assessmentId) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM submissions WHERE assessment_id=?", Long.class, assessmentId);
        return value != null && value > 0;
    }

    /** With {@code onlyWhilePending} the row is left alone once it has been evaluated; returns 0 then. */
    public int updateAnswers(String id, String content, int tabSwitches, boolean onlyWhilePending) {
        if (onlyWhilePending) {
            return jdbcTemplate.update("UPDATE submissions SET content=?, tab_switches=? WHERE id=? AND evaluation_status=?",
                    content, tabSwitches, id, EvaluationStatus.PENDING.name());
        }
        return jdbcTemplate.update("UPDATE submissions SET content=?, tab_switches=? WHERE id=?", content, tabSwitches, id);
    }

    /** Overwrites the evaluation columns. A null {@code evaluatorNotes} keeps the stored notes. */
    public int applyEvaluation(String id, int grade, String feedback, Instant evaluatedAt,
                               Map<String, Double> categoryScores, Map<String, String> evaluatorNotes) {
        return jdbcTemplate.update(
                "UPDATE submissions SET evaluation_status=?, grade=?, feedback=?, evaluated_at=?, category_scores=?, "
                        + "evaluator_notes=COALESCE(?, evaluator_notes) WHERE id=?",
                EvaluationStatus.EVALUATED.name(), grade, feedback, evaluatedAt.toString(), write(categoryScores),
                evaluatorNotes == null ? null : write(evaluatorNotes), id);
    }

    /** Returns 0 unless the row belongs to the user, is evaluated and has never been challenged. */
    public int openChallenge(String id, String userId, String reason, Instant challengeDate) {
        return jdbcTemplate.update(
                "UPDATE submissions SET challenge_status=?, challenge_reason=?, challenge_date=? "
                        + "WHERE id=? AND user_id=? AND evaluation_status=? AND challenge_status IS NULL",
                ChallengeStatus.PENDING.name(), reason, challengeDate.toString(),
                id, userId, EvaluationStatus.EVALUATED.name());
    }

    /** Returns 0 unless the challenge is still PENDING or REVIEWING. */
    public int recordChallengeResponse(String id, ChallengeStatus status, String adminResponse, Instant resolvedDate) {
        return jdbcTemplate.update(
                "UPDATE submissions SET challenge_status=?, challenge_admin_response=?, "
                        + "challenge_resolved_date=COALESCE(?, challenge_resolved_date) "
                        + "WHERE id=? AND challenge_status IN (?, ?)",
                status.name(), adminResponse, resolvedDate == null ? null : resolvedDate.toString(),
                id, ChallengeStatus.PENDING.name(), ChallengeStatus.REVIEWING.name());
    }

    private Submission mapRow(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString(1);
        String challengeStatus = rs.getString(14);
        Challenge challenge = challengeStatus == null ? null : new Challenge(
                ChallengeStatus.valueOf(challengeStatus), rs.getString(15), rs.getString(16),
                instant(rs.getString(17)), instant(rs.getString(18)));
        return new Submission(
                id, rs.getString(2), rs.getString(3), rs.getString(4),
                read(id, rs.getString(5), RESPONSES, Map.of()),
                rs.getInt(6), Instant.parse(rs.getString(7)),
                EvaluationStatus.valueOf(rs.getString(8)),
                (Integer) rs.getObject(9), rs.getString(10), instant(rs.getString(11)),
                read(id, rs.getString(12), SCORES, Map.of()),
                read(id, rs.getString(13), NOTES, Map.of()),
                challenge);
    }

    private Instant instant(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise submission column", e);
        }
    }

    private <T> T read(String id, String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column in submission " + id, e);
        }
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
