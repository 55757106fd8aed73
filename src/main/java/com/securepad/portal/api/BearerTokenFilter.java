package com.securepad.portal.api;

import com.securepad.portal.error.AuthenticationRequiredException;
import com.securepad.portal.identity.IdentityModels.Principal;
import com.securepad.portal.identity.IdentityService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Puts the {@link Principal} behind an {@code Authorization: Bearer} header into the security
 * context. Requests without the header pass through anonymous; a bad token ends the request
 * with 401.
 */
public class BearerTokenFilter extends OncePerRequestFilter {
    private final IdentityService identityService;
    private final AuthenticationEntryPoint entryPoint;

    public BearerTokenFilter(IdentityService identityService, AuthenticationEntryPoint entryPoint) {
        this.identityService = identityService;
        this.entryPoint = entryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }
        try {
            Principal principal = identityService.authenticate(header);
            var authentication = UsernamePasswordAuthenticationToken.authenticated(
                    principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (AuthenticationRequiredException e) {
            SecurityContextHolder.clearContext();
            entryPoint.commence(request, response, new BadCredentialsException(e.getMessage(), e));
            return;
        }
        filterChain.doFilter(request, response);
    }
}
