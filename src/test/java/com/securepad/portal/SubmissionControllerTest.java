package com.securepad.portal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securepad.portal.assessment.AssessmentModels.Assessment;
import com.securepad.portal.assessment.AssessmentService;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.identity.IdentityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SubmissionControllerTest {
    @Autowired
    MockMvc mockMvc;
    @Autowired
    ObjectMapper objectMapper;
    @Autowired
    IdentityService identityService;
    @Autowired
    AssessmentService assessmentService;

    PortalFixtures fixtures;
    String adminToken;
    String studentToken;
    Assessment assessment;

    @BeforeEach
    void setUp() {
        fixtures = new PortalFixtures(identityService, assessmentService);
        Principal admin = fixtures.admin();
        adminToken = "Bearer " + fixtures.tokenFor(admin);
        studentToken = "Bearer " + fixtures.tokenFor(fixtures.student());
        assessment = fixtures.mixedAssessment(admin);
    }

    private String submissionBody(String content) {
        return """
                {"assessmentId":"%s","content":"%s","tabSwitches":2,"mcqResponses":{"1":["Paris"],"2":["A","C"]}}
                """.formatted(assessment.id(), content);
    }

    private String createSubmission() throws Exception {
        String body = mockMvc.perform(post("/api/submissions")
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submissionBody("answer")))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("id").asText();
    }

    @Test
    void requiresBearerToken() throws Exception {
        mockMvc.perform(get("/api/submissions/mine"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("AUTHENTICATION_REQUIRED"))
                .andExpect(jsonPath("$.message").value("Not authorized, no token"));

        mockMvc.perform(get("/api/submissions/mine").header(HttpHeaders.AUTHORIZATION, "Bearer forged"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Not authorized, token failed"));
    }

    @Test
    void createReturnsPendingSubmissionThenRejectsDuplicate() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submissionBody("first")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.evaluationStatus").value("PENDING"))
                .andExpect(jsonPath("$.tabSwitches").value(2))
                .andExpect(jsonPath("$.grade").doesNotExist())
                .andExpect(jsonPath("$.challenge").doesNotExist());

        mockMvc.perform(post("/api/submissions")
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(submissionBody("second")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("DUPLICATE_SUBMISSION"));
    }

    @Test
    void mapsValidationAndLookupFailures() throws Exception {
        mockMvc.perform(post("/api/submissions")
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assessmentId\":\"" + assessment.id() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/submissions")
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/submissions/not-a-real-id").header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mockMvc.perform(get("/api/submissions").param("filter", "bogus").header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isBadRequest());
    }

    @Test
    void studentsCannotEvaluate() throws Exception {
        String id = createSubmission();

        mockMvc.perform(put("/api/submissions/{id}/evaluate", id)
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"grade\":100,\"feedback\":\"self\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("AUTHORIZATION_ERROR"));

        mockMvc.perform(put("/api/submissions/{id}/evaluate", id)
                        .header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"grade\":150,\"feedback\":\"over\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"));
    }

    @Test
    void evaluateChallengeAndRespondOverHttp() throws Exception {
        String id = createSubmission();

        mockMvc.perform(post("/api/submissions/{id}/challenge", id)
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"too early\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Only evaluated submissions can be challenged"));

        mockMvc.perform(put("/api/submissions/{id}/evaluate", id)
                        .header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"grade\":85,\"feedback\":\"Good work\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evaluationStatus").value("EVALUATED"))
                .andExpect(jsonPath("$.grade").value(85))
                .andExpect(jsonPath("$.categoryScores.Letters").value(100.0));

        mockMvc.perform(post("/api/submissions/{id}/challenge", id)
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Question 3 was ambiguous\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.challenge.status").value("PENDING"));

        mockMvc.perform(post("/api/submissions/{id}/challenge", id)
                        .header(HttpHeaders.AUTHORIZATION, studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"again\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("ALREADY_CHALLENGED"));

        String resolved = mockMvc.perform(put("/api/submissions/{id}/challenge/response", id)
                        .header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"[Status: ACCEPTED] Regraded\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode node = objectMapper.readTree(resolved);
        assertEquals("ACCEPTED", node.at("/challenge/status").asText());
        assertEquals(85, node.get("grade").asInt());

        mockMvc.perform(put("/api/submissions/{id}/challenge/response", id)
                        .header(HttpHeaders.AUTHORIZATION, adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"[Status: REJECTED]\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("NO_PENDING_CHALLENGE"));
    }

    @Test
    void studentDetailOmitsCorrectAnswers() throws Exception {
        String id = createSubmission();

        mockMvc.perform(get("/api/submissions/{id}", id).header(HttpHeaders.AUTHORIZATION, studentToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessment.questions[1].options[0]").value("Paris"))
                .andExpect(content().string(not(containsString("isCorrect"))));

        mockMvc.perform(get("/api/submissions/{id}", id).header(HttpHeaders.AUTHORIZATION, adminToken))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("isCorrect")));
    }
}
