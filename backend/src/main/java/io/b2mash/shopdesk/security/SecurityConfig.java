package io.b2mash.shopdesk.security;

import io.b2mash.shopdesk.routing.EdgeAuthorizationFilter;
import java.util.List;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Single stateless filter chain. The edge gate runs first for every request, then the session is
 * bound as an {@code Authentication} for {@code /api/**}, which requires one. Everything else is
 * governed by the gate alone.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final EdgeAuthorizationFilter edgeAuthorizationFilter;
  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final LoggingAuthenticationEntryPoint authenticationEntryPoint;
  private final Environment environment;

  public SecurityConfig(
      EdgeAuthorizationFilter edgeAuthorizationFilter,
      SessionAuthenticationFilter sessionAuthenticationFilter,
      RequestLoggingFilter requestLoggingFilter,
      LoggingAuthenticationEntryPoint authenticationEntryPoint,
      Environment environment) {
    this.edgeAuthorizationFilter = edgeAuthorizationFilter;
    this.sessionAuthenticationFilter = sessionAuthenticationFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.authenticationEntryPoint = authenticationEntryPoint;
    this.environment = environment;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource()))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers("/actuator/**")
                    .denyAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .permitAll())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))
        .addFilterBefore(edgeAuthorizationFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(sessionAuthenticationFilter, EdgeAuthorizationFilter.class)
        .addFilterAfter(requestLoggingFilter, SessionAuthenticationFilter.class);

    return http.build();
  }

  // The filters run inside the security chain only, not a second time as plain servlet filters.
  @Bean
  FilterRegistrationBean<EdgeAuthorizationFilter> edgeAuthorizationFilterRegistration(
      EdgeAuthorizationFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration(
      SessionAuthenticationFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilterRegistration(
      RequestLoggingFilter filter) {
    return disabled(filter);
  }

  private static <T extends jakarta.servlet.Filter> FilterRegistrationBean<T> disabled(T filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource() {
    List<String> origins =
        Binder.get(environment)
            .bind("cors.allowed-origins", Bindable.listOf(String.class))
            .orElse(List.of());

    var config = new CorsConfiguration();
    if (!origins.isEmpty()) {
      config.setAllowedOrigins(origins);
    }
    config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);

    var source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
