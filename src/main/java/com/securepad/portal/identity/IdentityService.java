package com.securepad.portal.identity;

import com.securepad.portal.error.AuthenticationRequiredException;
import com.securepad.portal.error.NotFoundException;
import com.securepad.portal.error.ValidationException;
import com.securepad.portal.identity.IdentityModels.IssuedToken;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.identity.IdentityModels.UserAccount;
import com.securepad.portal.identity.IdentityModels.UserRef;
import com.securepad.portal.repository.IdentityJdbcRepository;
import com.securepad.portal.repository.IdentityJdbcRepository.TokenRow;
import com.securepad.portal.repository.RecordIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Turns opaque bearer credentials into a {@link Principal}. Account provisioning lives here
 * too so deployments and tests can create users and hand out tokens; self-service
 * registration and login are handled elsewhere.
 */
@Service
public class IdentityService {
    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);
    private static final String BEARER_PREFIX = "bearer ";

    private final IdentityJdbcRepository repository;
    private final Clock clock;
    private final Duration tokenTtl;
    private final SecureRandom random = new SecureRandom();

    public IdentityService(IdentityJdbcRepository repository,
                           Clock clock,
                           @Value("${portal.identity.token-ttl-days:30}") long tokenTtlDays) {
        this.repository = repository;
        this.clock = clock;
        this.tokenTtl = Duration.ofDays(tokenTtlDays);
    }

    public Principal authenticate(String credential) {
        String token = stripScheme(credential);
        if (token == null) {
            throw new AuthenticationRequiredException("Not authorized, no token");
        }
        TokenRow row = repository.findToken(token)
                .orElseThrow(() -> new AuthenticationRequiredException("Not authorized, token failed"));
        if (!row.expiresAt().isAfter(Instant.now(clock))) {
            throw new AuthenticationRequiredException("Not authorized, token expired");
        }
        UserAccount user = repository.findUser(row.userId())
                .orElseThrow(() -> new AuthenticationRequiredException("Not authorized, token failed"));
        return new Principal(user.id(), user.role());
    }

    public UserAccount register(String handle, String email, Role role) {
        if (isBlank(handle) || isBlank(email) || role == null) {
            throw new ValidationException("Please provide all required fields");
        }
        if (repository.existsHandleOrEmail(handle.trim(), email.trim())) {
            throw new ValidationException("User ID or email already exists");
        }
        UserAccount user = new UserAccount(RecordIds.newId(), handle.trim(), email.trim(), role, Instant.now(clock));
        repository.insertUser(user);
        log.info("Registered {} account {} ({})", role, user.handle(), user.id());
        return user;
    }

    public IssuedToken issueToken(String userId) {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return issueToken(userId, HexFormat.of().formatHex(bytes));
    }

    public IssuedToken issueToken(String userId, String token) {
        if (isBlank(token)) {
            throw new ValidationException("Token must not be blank");
        }
        requireUser(userId);
        Instant now = Instant.now(clock);
        TokenRow row = new TokenRow(token, userId, now, now.plus(tokenTtl));
        repository.insertToken(row);
        return new IssuedToken(row.token(), row.userId(), row.expiresAt());
    }

    public boolean tokenExists(String token) {
        return repository.findToken(token).isPresent();
    }

    public Optional<UserAccount> findByHandle(String handle) {
        return repository.findUserByHandle(handle);
    }

    public UserAccount requireUser(String userId) {
        return repository.findUser(userId).orElseThrow(() -> new NotFoundException("User not found"));
    }

    public UserAccount me(Principal principal) {
        return requireUser(principal.id());
    }

    public Map<String, UserRef> userRefs(Collection<String> userIds) {
        Map<String, UserRef> refs = new HashMap<>();
        for (String id : new HashSet<>(userIds)) {
            repository.findUser(id).ifPresent(u -> refs.put(id, new UserRef(u.id(), u.handle(), u.email())));
        }
        return refs;
    }

    private String stripScheme(String credential) {
        if (credential == null || credential.isBlank()) return null;
        String value = credential.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            value = value.substring(BEARER_PREFIX.length()).trim();
        }
        return value.isEmpty() ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
