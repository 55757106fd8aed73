package com.securepad.portal.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Provisions one admin account and token at startup when
 * {@code portal.identity.bootstrap-admin.token} is set.
 */
@Component
public class BootstrapAdminRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    private final IdentityService identityService;
    private final String token;
    private final String handle;
    private final String email;

    public BootstrapAdminRunner(IdentityService identityService,
                                @Value("${portal.identity.bootstrap-admin.token:}") String token,
                                @Value("${portal.identity.bootstrap-admin.handle:admin}") String handle,
                                @Value("${portal.identity.bootstrap-admin.email:admin@localhost}") String email) {
        this.identityService = identityService;
        this.token = token;
        this.handle = handle;
        this.email = email;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (token == null || token.isBlank() || identityService.tokenExists(token)) {
            return;
        }
        var admin = identityService.findByHandle(handle)
                .orElseGet(() -> identityService.register(handle, email, Role.ADMIN));
        if (admin.role() != Role.ADMIN) {
            log.warn("Bootstrap handle {} belongs to a {} account, no token issued", handle, admin.role());
            return;
        }
        identityService.issueToken(admin.id(), token);
        log.info("Bootstrap admin token issued for {}", handle);
    }
}
