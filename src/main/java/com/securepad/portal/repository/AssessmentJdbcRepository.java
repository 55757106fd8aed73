package com.securepad.portal.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securepad.portal.assessment.AssessmentModels.Assessment;
import com.securepad.portal.assessment.AssessmentModels.Question;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class AssessmentJdbcRepository {
    private static final String COLUMNS = "id, title, description, created_by, is_active, time_limit, questions, created_at";
    private static final TypeReference<List<Question>> QUESTIONS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Assessment> mapper;

    public AssessmentJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.mapper = (rs, n) -> new Assessment(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                rs.getBoolean(5), rs.getInt(6), readQuestions(rs.getString(1), rs.getString(7)),
                Instant.parse(rs.getString(8)));
    }

    public void insert(Assessment a) {
        jdbcTemplate.update(
                "INSERT INTO assessments(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                a.id(), a.title(), a.description(), a.createdBy(), a.active(), a.timeLimit(),
                writeQuestions(a.questions()), a.createdAt().toString());
    }

    public void update(Assessment a) {
        jdbcTemplate.update(
                "UPDATE assessments SET title=?, description=?, is_active=?, time_limit=?, questions=? WHERE id=?",
                a.title(), a.description(), a.active(), a.timeLimit(), writeQuestions(a.questions()), a.id());
    }

    /** Writes like {@link #update} but only while no submission references the assessment; returns 0 otherwise. */
    public int updateUnlessSubmitted(Assessment a) {
        return jdbcTemplate.update(
                "UPDATE assessments SET title=?, description=?, is_active=?, time_limit=?, questions=? "
                        + "WHERE id=? AND NOT EXISTS (SELECT 1 FROM submissions WHERE assessment_id=?)",
                a.title(), a.description(), a.active(), a.timeLimit(), writeQuestions(a.questions()), a.id(), a.id());
    }

    public int setActive(String id, boolean active) {
        return jdbcTemplate.update("UPDATE assessments SET is_active=? WHERE id=?", active, id);
    }

    public Optional<Assessment> findById(String id) {
        List<Assessment> rows = jdbcTemplate.query("SELECT " + COLUMNS + " FROM assessments WHERE id=?", mapper, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Assessment> findAll(boolean activeOnly) {
        if (activeOnly) {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM assessments WHERE is_active = TRUE", mapper);
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM assessments", mapper);
    }

    public int deleteUnlessSubmitted(String id) {
        return jdbcTemplate.update(
                "DELETE FROM assessments WHERE id=? AND NOT EXISTS (SELECT 1 FROM submissions WHERE assessment_id=?)", id, id);
    }

    private String writeQuestions(List<Question> questions) {
        try {
            return objectMapper.writeValueAsString(questions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise assessment questions", e);
        }
    }

    private List<Question> readQuestions(String assessmentId, String json) {
        try {
            return objectMapper.readValue(json, QUESTIONS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt question list for assessment " + assessmentId, e);
        }
    }
}
