package com.codeheadsystems.tollgate.springboot.controller;

import com.codeheadsystems.tollgate.server.manager.TollgateAuthManager;
import com.codeheadsystems.tollgate.server.model.LoginResult;
import com.codeheadsystems.tollgate.server.model.Role;
import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

  private static final Logger log = LoggerFactory.getLogger(AuthController.class);

  private final TollgateAuthManager authManager;

  public AuthController(TollgateAuthManager authManager) {
    this.authManager = authManager;
  }

  @PostMapping("/login")
  public LoginResult login(@RequestBody LoginRequest req) {
    log.debug("login()");
    return authManager.login(req.email(), req.password());
  }

  @PostMapping("/logout")
  public ResponseEntity<Void> logout(@AuthenticationPrincipal TollgatePrincipal principal) {
    log.debug("logout()");
    authManager.logout(principal);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/me")
  public PrincipalView me(@AuthenticationPrincipal TollgatePrincipal principal) {
    return new PrincipalView(principal.subjectId(), principal.email(), principal.displayName(),
        principal.role());
  }

  /**
   * Login request body.
   *
   * @param email    the email
   * @param password the password
   */
  public record LoginRequest(String email, String password) {
  }

  /**
   * The caller's identity as resolved from their token.
   *
   * @param userId the user id
   * @param email  the email
   * @param name   the display name
   * @param role   the role
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record PrincipalView(String userId, String email, String name, Role role) {
  }
}
