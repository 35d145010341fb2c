package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.model.Role;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a controller method, or every method of a controller, to principals holding any one
 * of the listed roles. A method-level annotation replaces the class-level one. An empty list
 * means any authenticated principal.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresRoles {

  /**
   * Accepted roles.
   *
   * @return the roles
   */
  Role[] value() default {};
}
