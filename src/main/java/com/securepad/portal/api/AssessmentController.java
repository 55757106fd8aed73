package com.securepad.portal.api;

import com.securepad.portal.assessment.AssessmentModels;
import com.securepad.portal.assessment.AssessmentService;
import com.securepad.portal.identity.IdentityModels.Principal;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {
    private final AssessmentService assessmentService;

    public AssessmentController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @GetMapping
    public ResponseEntity<List<AssessmentModels.AssessmentPayload>> list(@AuthenticationPrincipal Principal principal) {
        return ResponseEntity.ok(assessmentService.listFor(principal));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AssessmentModels.AssessmentPayload> get(@AuthenticationPrincipal Principal principal, @PathVariable String id) {
        return ResponseEntity.ok(assessmentService.getFor(principal, id));
    }

    @PostMapping
    public ResponseEntity<AssessmentModels.Assessment> create(@AuthenticationPrincipal Principal principal,
                                                              @RequestBody AssessmentModels.AssessmentDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assessmentService.create(principal, draft));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AssessmentModels.Assessment> update(@AuthenticationPrincipal Principal principal,
                                                              @PathVariable String id,
                                                              @RequestBody AssessmentModels.AssessmentUpdate update) {
        return ResponseEntity.ok(assessmentService.update(principal, id, update));
    }

    @PutMapping("/{id}/activate")
    public ResponseEntity<AssessmentModels.Assessment> activate(@AuthenticationPrincipal Principal principal, @PathVariable String id) {
        return ResponseEntity.ok(assessmentService.setActive(principal, id, true));
    }

    @PutMapping("/{id}/deactivate")
    public ResponseEntity<AssessmentModels.Assessment> deactivate(@AuthenticationPrincipal Principal principal, @PathVariable String id) {
        return ResponseEntity.ok(assessmentService.setActive(principal, id, false));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@AuthenticationPrincipal Principal principal, @PathVariable String id) {
        assessmentService.delete(principal, id);
        return ResponseEntity.ok(Map.of("message", "Assessment removed"));
    }
}
