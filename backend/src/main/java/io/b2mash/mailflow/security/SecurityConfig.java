package io.b2mash.mailflow.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Webhook ingress and health are public; admin and internal endpoints require the API key. The
 * pipeline services themselves perform no authorization.
 */
@Configuration
@EnableWebSecurity
@Profile("!local")
public class SecurityConfig {

  private final String internalApiKey;

  public SecurityConfig(@Value("${internal.api.key:}") String internalApiKey) {
    this.internalApiKey = internalApiKey;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health")
                    .permitAll()
                    .requestMatchers("/api/webhooks/email", "/api/webhooks/email/**")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .authenticated()
                    .requestMatchers("/api/email/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .addFilterBefore(new ApiKeyAuthFilter(internalApiKey), AnonymousAuthenticationFilter.class);

    return http.build();
  }
}
