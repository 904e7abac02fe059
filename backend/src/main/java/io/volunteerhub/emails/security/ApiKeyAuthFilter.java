package io.volunteerhub.emails.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates delivery workers by a shared API key sent in the {@code X-API-KEY} header. Only
 * requests under {@code /api/} are filtered.
 */
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);
  private static final String API_KEY_HEADER = "X-API-KEY";

  private final byte[] expectedApiKey;

  public ApiKeyAuthFilter(@Value("${internal.api.key}") String expectedApiKey) {
    this.expectedApiKey = expectedApiKey.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String apiKey = request.getHeader(API_KEY_HEADER);

    if (apiKey != null
        && MessageDigest.isEqual(expectedApiKey, apiKey.getBytes(StandardCharsets.UTF_8))) {
      SecurityContextHolder.getContext().setAuthentication(new WorkerAuthenticationToken());
      filterChain.doFilter(request, response);
    } else {
      log.warn(
          "Rejected worker request without valid API key: path={}, method={}",
          request.getRequestURI(),
          request.getMethod());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }

  private static class WorkerAuthenticationToken extends AbstractAuthenticationToken {

    WorkerAuthenticationToken() {
      super(List.of(new SimpleGrantedAuthority("ROLE_EMAIL_WORKER")));
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return "email-worker";
    }
  }
}
