package com.securepad.portal.api;

import com.securepad.portal.identity.IdentityModels;
import com.securepad.portal.identity.IdentityModels.Principal;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import com.securepad.portal.identity.IdentityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/identity")
public class IdentityController {
    private final IdentityService identityService;

    public IdentityController(IdentityService identityService) {
        this.identityService = identityService;
    }

    @GetMapping("/me")
    public ResponseEntity<IdentityModels.UserAccount> me(@AuthenticationPrincipal Principal principal) {
        return ResponseEntity.ok(identityService.me(principal));
    }
}
