package com.codeheadsystems.tollgate.server.guard;

import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import java.util.Optional;

/**
 * Outcome of running the full guard chain for one request.
 *
 * @param outcome         what the caller should do
 * @param principal       the authenticated principal; present for GRANTED and FORBIDDEN
 * @param rejectionReason why authentication failed; present for UNAUTHENTICATED
 */
public record AccessDecision(Outcome outcome, Optional<TollgatePrincipal> principal,
                             Optional<RejectionReason> rejectionReason) {

  /**
   * Guard chain outcomes. FORBIDDEN always means the caller was authenticated.
   */
  public enum Outcome {
    GRANTED,
    UNAUTHENTICATED,
    FORBIDDEN
  }

  static AccessDecision granted(TollgatePrincipal principal) {
    return new AccessDecision(Outcome.GRANTED, Optional.of(principal), Optional.empty());
  }

  static AccessDecision forbidden(TollgatePrincipal principal) {
    return new AccessDecision(Outcome.FORBIDDEN, Optional.of(principal), Optional.empty());
  }

  static AccessDecision unauthenticated(RejectionReason reason) {
    return new AccessDecision(Outcome.UNAUTHENTICATED, Optional.empty(), Optional.of(reason));
  }

  public boolean isGranted() {
    return outcome == Outcome.GRANTED;
  }
}
