package com.bugbounty.api.config;

import com.bugbounty.api.auth.JwtTokenService;
import com.bugbounty.api.error.ErrorResponseWriter;
import com.bugbounty.api.security.BearerTokenAuthenticationFilter;
import com.bugbounty.api.security.JsonAccessDeniedHandler;
import com.bugbounty.api.security.JsonAuthenticationEntryPoint;
import com.bugbounty.core.repository.UserRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration.
 *
 * Request pipeline: rate admission, bearer token identity, then the role
 * gate below. The role gate only looks at the route and the caller's role;
 * ownership of individual programs and reports is checked in the services.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String COMPANY = "COMPANY";
    private static final String RESEARCHER = "RESEARCHER";

    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            JwtTokenService jwtTokenService,
            UserRepository userRepository,
            RateLimitConfig rateLimitConfig,
            RateLimitProperties rateLimitProperties,
            ErrorResponseWriter errorWriter) throws Exception {

        BearerTokenAuthenticationFilter bearerFilter =
                new BearerTokenAuthenticationFilter(jwtTokenService, userRepository, errorWriter);
        RateLimitFilter rateLimitFilter =
                new RateLimitFilter(rateLimitConfig, rateLimitProperties, errorWriter);

        http
            .csrf(csrf -> csrf.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .logout(logout -> logout.disable())
            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(bearerFilter, AnonymousAuthenticationFilter.class)
            .addFilterBefore(rateLimitFilter, UsernamePasswordAuthenticationFilter.class)
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(new JsonAuthenticationEntryPoint(errorWriter))
                .accessDeniedHandler(new JsonAccessDeniedHandler(errorWriter)))
            .authorizeHttpRequests(auth -> auth
                // Public
                .requestMatchers(HttpMethod.GET, "/api", "/api/health").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/auth/register", "/api/auth/login").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/programs", "/api/programs/*").permitAll()
                // Any authenticated role
                .requestMatchers(HttpMethod.GET, "/api/auth/me").authenticated()
                // Programs
                .requestMatchers(HttpMethod.POST, "/api/programs").hasRole(COMPANY)
                .requestMatchers(HttpMethod.PUT, "/api/programs/*").hasRole(COMPANY)
                .requestMatchers(HttpMethod.DELETE, "/api/programs/*").hasRole(COMPANY)
                // Reports
                .requestMatchers(HttpMethod.POST, "/api/reports").hasRole(RESEARCHER)
                .requestMatchers(HttpMethod.PATCH, "/api/reports/*/status").hasRole(COMPANY)
                .requestMatchers(HttpMethod.GET, "/api/reports/program/*", "/api/reports/*")
                    .hasAnyRole(COMPANY, RESEARCHER)
                .anyRequest().permitAll()
            );

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(10);
    }
}
