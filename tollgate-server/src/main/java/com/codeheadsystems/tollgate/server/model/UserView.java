package com.codeheadsystems.tollgate.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * User details returned to callers. Never carries the password digest.
 *
 * @param id          the id
 * @param email       the email
 * @param displayName the display name
 * @param role        the role
 * @param active      the active flag
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserView(String id, String email, String displayName, Role role, boolean active) {
}
