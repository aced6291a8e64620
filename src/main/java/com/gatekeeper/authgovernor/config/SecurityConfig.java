package com.gatekeeper.authgovernor.config;

import com.gatekeeper.authgovernor.application.DeviceSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.time.Clock;
import java.util.Arrays;

@Configuration
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

  private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedOriginPatterns(Arrays.asList("*"));
    configuration.setAllowedMethods(Arrays.asList(
            "GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS", "HEAD"
    ));
    configuration.setAllowedHeaders(Arrays.asList(
            "Authorization",
            "Content-Type",
            "X-Requested-With",
            "Accept",
            "Origin",
            "X-Forwarded-For",
            "X-Device-Id",
            "Access-Control-Request-Method",
            "Access-Control-Request-Headers"
    ));
    configuration.setExposedHeaders(Arrays.asList("Retry-After"));
    configuration.setAllowCredentials(true);
    configuration.setMaxAge(3600L);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", configuration);
    return source;
  }

  @Bean
  SecurityFilterChain security(HttpSecurity http, JwtService jwtService, DeviceSessionService deviceSessions,
                               Clock clock) throws Exception {
    JwtAuthFilter jwtFilter = new JwtAuthFilter(jwtService, deviceSessions, clock);

    http
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                    .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                    .requestMatchers(HttpMethod.POST, "/auth/login").permitAll()
                    .requestMatchers(HttpMethod.POST, "/auth/password-reset/request", "/auth/password-reset/confirm").permitAll()
                    .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                    .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                    .requestMatchers("/error").permitAll()

                    .requestMatchers("/actuator/**").hasRole("ADMIN")
                    .requestMatchers("/admin/**").hasRole("ADMIN")

                    .anyRequest().authenticated())
            .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
            .exceptionHandling(e -> e
                    .authenticationEntryPoint(json401())
                    .accessDeniedHandler(json403())
            );

    log.info("Security filter chain configured (stateless JWT, device-bound sessions for capped users)");
    return http.build();
  }

  private AuthenticationEntryPoint json401() {
    return (request, response, ex) -> {
      log.warn("Authentication failed for {} {}: {}",
              request.getMethod(), request.getRequestURI(), ex.getMessage());

      response.setStatus(401);
      response.setContentType("application/json");
      response.setCharacterEncoding("UTF-8");
      response.getWriter().write(
              "{\"error\":\"Unauthorized\"," +
                      "\"message\":\"Valid Bearer token required\"," +
                      "\"path\":\"" + request.getRequestURI() + "\"}"
      );
    };
  }

  private AccessDeniedHandler json403() {
    return (request, response, ex) -> {
      log.warn("Access denied for {} {}: {}",
              request.getMethod(), request.getRequestURI(), ex.getMessage());

      response.setStatus(403);
      response.setContentType("application/json");
      response.setCharacterEncoding("UTF-8");
      response.getWriter().write(
              "{\"error\":\"Forbidden\"," +
                      "\"message\":\"Insufficient role\"," +
                      "\"path\":\"" + request.getRequestURI() + "\"}"
      );
    };
  }
}
