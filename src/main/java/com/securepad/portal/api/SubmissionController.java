package com.securepad.portal.api;

import com.securepad.portal.identity.IdentityModels.Principal;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import com.securepad.portal.scoring.ScoringModels;
import com.securepad.portal.submission.ChallengeService;
import com.securepad.portal.submission.SubmissionModels;
import com.securepad.portal.submission.SubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/submissions")
public class SubmissionController {
    private final SubmissionService submissionService;
    private final ChallengeService challengeService;

    public SubmissionController(SubmissionService submissionService, ChallengeService challengeService) {
        this.submissionService = submissionService;
        this.challengeService = challengeService;
    }

    @PostMapping
    public ResponseEntity<SubmissionModels.Submission> create(@AuthenticationPrincipal Principal principal,
                                                              @RequestBody SubmissionModels.SubmissionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(submissionService.createSubmission(principal, request));
    }

    @GetMapping("/mine")
    public ResponseEntity<List<SubmissionModels.SubmissionListing>> mine(@AuthenticationPrincipal Principal principal) {
        return ResponseEntity.ok(submissionService.listMine(principal));
    }

    @GetMapping
    public ResponseEntity<List<SubmissionModels.SubmissionListing>> all(@AuthenticationPrincipal Principal principal,
                                                                        @RequestParam(defaultValue = "ALL") SubmissionModels.SubmissionFilter filter) {
        return ResponseEntity.ok(submissionService.listAll(principal, filter));
    }

    @GetMapping("/assessment/{assessmentId}")
    public ResponseEntity<List<SubmissionModels.SubmissionListing>> forAssessment(@AuthenticationPrincipal Principal principal,
                                                                                  @PathVariable String assessmentId) {
        return ResponseEntity.ok(submissionService.listForAssessment(principal, assessmentId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubmissionModels.SubmissionDetail> get(@AuthenticationPrincipal Principal principal, @PathVariable String id) {
        return ResponseEntity.ok(submissionService.getById(principal, id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<SubmissionModels.Submission> update(@AuthenticationPrincipal Principal principal,
                                                              @PathVariable String id,
                                                              @RequestBody SubmissionModels.SubmissionUpdate update) {
        return ResponseEntity.ok(submissionService.update(principal, id, update));
    }

    @PutMapping("/{id}/evaluate")
    public ResponseEntity<SubmissionModels.Submission> evaluate(@AuthenticationPrincipal Principal principal,
                                                                @PathVariable String id,
                                                                @RequestBody SubmissionModels.EvaluationRequest request) {
        return ResponseEntity.ok(submissionService.evaluate(principal, id, request));
    }

    @GetMapping("/{id}/score")
    public ResponseEntity<ScoringModels.ScoreReport> score(@AuthenticationPrincipal Principal principal, @PathVariable String id) {
        return ResponseEntity.ok(submissionService.previewScore(principal, id));
    }

    @PostMapping("/{id}/challenge")
    public ResponseEntity<SubmissionModels.Submission> challenge(@AuthenticationPrincipal Principal principal,
                                                                 @PathVariable String id,
                                                                 @RequestBody SubmissionModels.ChallengeRequest request) {
        return ResponseEntity.ok(challengeService.fileChallenge(principal, id, request == null ? null : request.reason()));
    }

    @PutMapping("/{id}/challenge/response")
    public ResponseEntity<SubmissionModels.Submission> respond(@AuthenticationPrincipal Principal principal,
                                                               @PathVariable String id,
                                                               @RequestBody SubmissionModels.ChallengeResponseRequest request) {
        return ResponseEntity.ok(challengeService.respondToChallenge(principal, id,
                request == null ? null : request.response(), request == null ? null : request.status()));
    }
}
