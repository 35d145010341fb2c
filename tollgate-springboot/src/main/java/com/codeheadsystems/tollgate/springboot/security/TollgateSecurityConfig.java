package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.server.guard.AuthenticationGuard;
import com.codeheadsystems.tollgate.server.guard.AuthorizationGuard;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableWebSecurity
public class TollgateSecurityConfig implements WebMvcConfigurer {

  private final AuthorizationGuard authorizationGuard;
  private final JsonErrorResponder errorResponder;

  public TollgateSecurityConfig(AuthorizationGuard authorizationGuard, ObjectMapper objectMapper) {
    this.authorizationGuard = authorizationGuard;
    this.errorResponder = new JsonErrorResponder(objectMapper);
  }

  @Bean
  public JwtAuthenticationFilter jwtAuthenticationFilter(AuthenticationGuard authenticationGuard) {
    return new JwtAuthenticationFilter(authenticationGuard);
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 JwtAuthenticationFilter jwtFilter) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.POST, "/auth/login").permitAll()
            .requestMatchers("/actuator/health", "/error").permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(errorResponder)
            .accessDeniedHandler(errorResponder))
        .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(new RoleAuthorizationInterceptor(authorizationGuard, errorResponder));
  }
}
