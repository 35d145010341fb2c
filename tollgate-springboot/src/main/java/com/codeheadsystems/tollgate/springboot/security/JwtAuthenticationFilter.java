package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.guard.AuthenticationGuard;
import com.codeheadsystems.tollgate.server.guard.AuthenticationResult;
import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link AuthenticationGuard} for every request and, on success, places the
 * {@link TollgatePrincipal} in the security context. Rejected requests continue unauthenticated;
 * the security chain answers 401 for protected routes.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  /**
   * Request attribute carrying the {@code RejectionReason} of a failed authentication.
   */
  public static final String REJECTION_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".rejection";

  private final AuthenticationGuard authenticationGuard;

  /**
   * Instantiates a new Jwt authentication filter.
   *
   * @param authenticationGuard the authentication guard
   */
  public JwtAuthenticationFilter(AuthenticationGuard authenticationGuard) {
    this.authenticationGuard = authenticationGuard;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (authHeader != null) {
      AuthenticationResult result = authenticationGuard.authenticate(authHeader);
      result.principal().ifPresentOrElse(
          principal -> SecurityContextHolder.getContext().setAuthentication(
              new UsernamePasswordAuthenticationToken(principal, null, authorities(principal))),
          () -> request.setAttribute(REJECTION_ATTRIBUTE, result.rejectionReason().orElse(null)));
    }
    filterChain.doFilter(request, response);
  }

  private static List<GrantedAuthority> authorities(TollgatePrincipal principal) {
    return principal.roleOptional()
        .<List<GrantedAuthority>>map(role -> List.of(new SimpleGrantedAuthority("ROLE_" + role.name())))
        .orElse(List.of());
  }
}
