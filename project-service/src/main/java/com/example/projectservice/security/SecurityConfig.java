package com.example.projectservice.security;

import com.example.projectservice.entity.UserRole;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.access.RequestMatcherDelegatingAccessDeniedHandler;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.RequestMatcher;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

/**
 * Stateless JWT security for the project service.
 *
 * Routes open to a single role are gated here. Everything else under /api only needs a
 * verified token; per-project rules (assigned advisor, team member, comment author) live in the services.
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    /**
     * Route to the only role allowed on it.
     */
    private static final Map<RequestMatcher, UserRole> ROLE_GATES = roleGates();

    private final JwtAuthenticationFilter jwtAuthFilter;
    private final SecurityErrorHandler securityErrorHandler;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(auth -> {
                auth.requestMatchers(antMatcher("/actuator/health"), antMatcher("/actuator/info")).permitAll();
                auth.requestMatchers(antMatcher("/swagger-ui/**"), antMatcher("/swagger-ui.html"),
                        antMatcher("/v3/api-docs/**")).permitAll();
                ROLE_GATES.forEach((route, role) -> auth.requestMatchers(route).hasRole(role.name()));
                auth.requestMatchers(antMatcher("/api/projects/**"), antMatcher("/api/comments/**")).authenticated();
                auth.anyRequest().authenticated();
            })
            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(securityErrorHandler)
                .accessDeniedHandler(roleGateDeniedHandler())
            )
            .addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    private AccessDeniedHandler roleGateDeniedHandler() {
        LinkedHashMap<RequestMatcher, AccessDeniedHandler> handlers = new LinkedHashMap<>();
        ROLE_GATES.forEach((route, role) -> handlers.put(route, securityErrorHandler.requiringRole(role)));
        return new RequestMatcherDelegatingAccessDeniedHandler(handlers, securityErrorHandler);
    }

    private static Map<RequestMatcher, UserRole> roleGates() {
        Map<RequestMatcher, UserRole> gates = new LinkedHashMap<>();
        gates.put(antMatcher(HttpMethod.POST, "/api/projects"), UserRole.STUDENT);
        gates.put(antMatcher(HttpMethod.GET, "/api/projects/course/**"), UserRole.COORDINATOR);
        return gates;
    }
}
