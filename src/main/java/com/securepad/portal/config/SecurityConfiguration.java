package com.securepad.portal.config;

import com.securepad.portal.api.BearerTokenFilter;
import com.securepad.portal.api.SecurityErrorHandlers;
import com.securepad.portal.identity.IdentityService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless bearer-token security. Admin-only routes are gated here as well as in the
 * services, which still receive the caller as an explicit principal.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfiguration {

    @Bean
    public SecurityFilterChain apiSecurity(HttpSecurity http,
                                           IdentityService identityService,
                                           SecurityErrorHandlers errorHandlers) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(errorHandlers)
                        .accessDeniedHandler(errorHandlers))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/submissions", "/api/submissions/assessment/**",
                                "/api/submissions/*/score").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PUT, "/api/submissions/*/evaluate",
                                "/api/submissions/*/challenge/response").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.POST, "/api/assessments").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PUT, "/api/assessments/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.DELETE, "/api/assessments/**").hasRole("ADMIN")
                        .anyRequest().authenticated())
                .addFilterBefore(new BearerTokenFilter(identityService, errorHandlers),
                        UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }
}
