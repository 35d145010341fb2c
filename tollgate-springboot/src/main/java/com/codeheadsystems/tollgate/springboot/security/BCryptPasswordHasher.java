package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.auth.PasswordHasher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * {@link PasswordHasher} using spring-security-crypto's BCrypt.
 */
public class BCryptPasswordHasher implements PasswordHasher {

  private final BCryptPasswordEncoder encoder;

  public BCryptPasswordHasher() {
    this(new BCryptPasswordEncoder());
  }

  public BCryptPasswordHasher(BCryptPasswordEncoder encoder) {
    this.encoder = encoder;
  }

  @Override
  public String hash(String plaintext) {
    return encoder.encode(plaintext);
  }

  @Override
  public boolean verify(String plaintext, String digest) {
    if (plaintext == null || digest == null || digest.isEmpty()) {
      return false;
    }
    return encoder.matches(plaintext, digest);
  }
}
