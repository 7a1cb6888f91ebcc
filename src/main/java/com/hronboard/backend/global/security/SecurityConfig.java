package com.hronboard.backend.global.security;

import java.util.Arrays;

import com.hronboard.backend.modules.access.domain.Permission;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Value("${app.cors.allowed-origins:http://localhost:5173,http://localhost:3000}")
    private String allowedOrigins;

    private final SessionAuthenticationFilter sessionAuthenticationFilter;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;
    private final RestAccessDeniedHandler accessDeniedHandler;

    public SecurityConfig(
            SessionAuthenticationFilter sessionAuthenticationFilter,
            RestAuthenticationEntryPoint authenticationEntryPoint,
            RestAccessDeniedHandler accessDeniedHandler
    ) {
        this.sessionAuthenticationFilter = sessionAuthenticationFilter;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.accessDeniedHandler = accessDeniedHandler;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(authz -> authz
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/auth/register", "/api/auth/login").permitAll()
                        .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/checklist/c/*").permitAll()
                        .requestMatchers("/actuator/**").hasAuthority(Permission.SYSTEM_LOGS.getCode())

                        .requestMatchers(HttpMethod.GET, "/api/auth/sessions").hasAuthority(Permission.SESSIONS_VIEW_OWN.getCode())
                        .requestMatchers(HttpMethod.DELETE, "/api/auth/sessions/*").hasAuthority(Permission.SESSIONS_TERMINATE_OWN.getCode())
                        .requestMatchers("/api/auth/**").authenticated()

                        .requestMatchers("/api/users/profile", "/api/users/change-password").authenticated()
                        .requestMatchers(HttpMethod.GET, "/api/users").hasAuthority(Permission.USERS_READ_ALL.getCode())
                        .requestMatchers(HttpMethod.POST, "/api/users/*/deactivate").hasAuthority(Permission.USERS_DELETE.getCode())
                        .requestMatchers("/api/users/*").authenticated()

                        .requestMatchers(HttpMethod.GET, "/api/templates", "/api/templates/**").hasAuthority(Permission.TEMPLATES_VIEW.getCode())
                        .requestMatchers(HttpMethod.POST, "/api/templates").hasAuthority(Permission.TEMPLATES_CREATE.getCode())
                        .requestMatchers(HttpMethod.POST, "/api/templates/*/clone").hasAuthority(Permission.TEMPLATES_CLONE.getCode())
                        .requestMatchers(HttpMethod.POST, "/api/templates/*/archive").hasAuthority(Permission.TEMPLATES_APPROVE.getCode())
                        .requestMatchers(HttpMethod.PUT, "/api/templates/*").hasAuthority(Permission.TEMPLATES_EDIT.getCode())
                        .requestMatchers(HttpMethod.DELETE, "/api/templates/*").hasAuthority(Permission.TEMPLATES_DELETE.getCode())

                        .requestMatchers(HttpMethod.POST, "/api/checklist/share").hasAuthority(Permission.CHECKLISTS_CREATE.getCode())

                        .requestMatchers(HttpMethod.GET, "/api/template-approval/requests", "/api/template-approval/requests/*")
                        .hasAuthority(Permission.USERS_READ_ALL.getCode())
                        .requestMatchers(HttpMethod.POST, "/api/template-approval/templates/*/submit")
                        .hasAuthority(Permission.TEMPLATES_EDIT.getCode())
                        .requestMatchers(HttpMethod.POST,
                                "/api/template-approval/requests/*/approve",
                                "/api/template-approval/requests/*/reject")
                        .hasAuthority(Permission.TEMPLATES_APPROVE.getCode())
                        .requestMatchers(HttpMethod.GET, "/api/template-approval/templates/*/history")
                        .hasAuthority(Permission.TEMPLATES_VIEW.getCode())

                        .anyRequest().authenticated()
                )
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    /**
     * The filter only runs inside the security chain, never as a plain servlet filter.
     */
    @Bean
    public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration(
            SessionAuthenticationFilter filter) {
        FilterRegistrationBean<SessionAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedOrigins(Arrays.asList(allowedOrigins.split(",")));
        config.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(Arrays.asList("*"));
        config.setExposedHeaders(Arrays.asList("Authorization", "Location", "X-Request-Id"));
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }
}
