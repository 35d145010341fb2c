package com.codeheadsystems.tollgate.server.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of a successful login.
 *
 * @param user        the logged-in user
 * @param accessToken the signed bearer token handed to the caller
 * @param tokenId     the token's {@code jti}; kept server-side and not serialized
 */
public record LoginResult(UserView user, String accessToken, @JsonIgnore String tokenId) {
}
