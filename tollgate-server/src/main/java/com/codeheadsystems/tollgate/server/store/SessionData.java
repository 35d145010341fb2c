package com.codeheadsystems.tollgate.server.store;

import com.codeheadsystems.tollgate.server.model.Role;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Value stored for a live session, serialized as JSON.
 * <p>
 * The role is captured at login and not updated afterwards; a role change takes effect on the
 * user's next login.
 *
 * @param userId    the user id (token subject)
 * @param email     the user's email
 * @param role      the user's role at login, omitted when absent
 * @param createdAt when the session was created
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionData(String userId, String email, Role role, Instant createdAt) {
}
