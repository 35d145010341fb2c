package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.guard.AuthorizationGuard;
import com.codeheadsystems.tollgate.server.model.RoleRequirement;
import com.codeheadsystems.tollgate.server.model.TollgatePrincipal;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Arrays;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequiresRoles} with the {@link AuthorizationGuard}. Runs after the security
 * filter chain, so the principal (if any) is already in the security context.
 */
public class RoleAuthorizationInterceptor implements HandlerInterceptor {

  private final AuthorizationGuard authorizationGuard;
  private final JsonErrorResponder errorResponder;

  public RoleAuthorizationInterceptor(AuthorizationGuard authorizationGuard,
                                      JsonErrorResponder errorResponder) {
    this.authorizationGuard = authorizationGuard;
    this.errorResponder = errorResponder;
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                           Object handler) throws Exception {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return true;
    }
    RoleRequirement requirement = requirementOf(handlerMethod);
    if (authorizationGuard.isAuthorized(currentPrincipal(), requirement)) {
      return true;
    }
    errorResponder.forbidden(response);
    return false;
  }

  static RoleRequirement requirementOf(HandlerMethod handlerMethod) {
    RequiresRoles annotation = AnnotatedElementUtils.findMergedAnnotation(
        handlerMethod.getMethod(), RequiresRoles.class);
    if (annotation == null) {
      annotation = AnnotatedElementUtils.findMergedAnnotation(
          handlerMethod.getBeanType(), RequiresRoles.class);
    }
    if (annotation == null || annotation.value().length == 0) {
      return RoleRequirement.unrestricted();
    }
    return RoleRequirement.anyOf(Arrays.asList(annotation.value()));
  }

  private static TollgatePrincipal currentPrincipal() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.getPrincipal() instanceof TollgatePrincipal principal) {
      return principal;
    }
    return null;
  }
}
