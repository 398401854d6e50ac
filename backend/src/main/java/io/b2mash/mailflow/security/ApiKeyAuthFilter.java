package io.b2mash.mailflow.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates callers of the admin ({@code /api/email/**}) and internal ({@code /internal/**})
 * endpoints by the shared {@code X-API-KEY} header. Created by {@link SecurityConfig} rather than
 * registered as a bean, so it only runs inside the security filter chain.
 */
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  static final String API_KEY_HEADER = "X-API-KEY";

  private final byte[] expectedApiKey;

  public ApiKeyAuthFilter(String expectedApiKey) {
    this.expectedApiKey =
        (expectedApiKey != null ? expectedApiKey : "").getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String apiKey = request.getHeader(API_KEY_HEADER);

    if (matches(apiKey)) {
      var auth = new ApiKeyAuthenticationToken();
      SecurityContextHolder.getContext().setAuthentication(auth);
      filterChain.doFilter(request, response);
    } else {
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    var uri = request.getRequestURI();
    return !uri.startsWith("/internal/") && !uri.startsWith("/api/email/");
  }

  private boolean matches(String apiKey) {
    // An unset key locks the endpoints instead of opening them
    if (expectedApiKey.length == 0 || apiKey == null) {
      return false;
    }
    return MessageDigest.isEqual(expectedApiKey, apiKey.getBytes(StandardCharsets.UTF_8));
  }

  private static class ApiKeyAuthenticationToken extends AbstractAuthenticationToken {

    ApiKeyAuthenticationToken() {
      super(List.of(new SimpleGrantedAuthority("ROLE_INTERNAL_SERVICE")));
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return "internal-service";
    }
  }
}
