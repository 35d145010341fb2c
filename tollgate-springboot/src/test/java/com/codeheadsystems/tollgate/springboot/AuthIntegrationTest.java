package com.codeheadsystems.tollgate.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tollgate.server.auth.TokenIssuer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AuthIntegrationTest {

  private static final String UNAUTHORIZED_BODY = "{\"error\":\"UNAUTHORIZED\",\"message\":\"Unauthorized\"}";
  private static final String FORBIDDEN_BODY = "{\"error\":\"FORBIDDEN\",\"message\":\"Forbidden\"}";

  private final ObjectMapper objectMapper = new ObjectMapper();

  @LocalServerPort
  private int port;

  @Autowired
  private TokenIssuer tokenIssuer;

  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
  }

  @Test
  void loginThenMe_returnsPrincipal() throws Exception {
    HttpResponse<String> login = login("alice@example.com", TollgateTestApplication.PASSWORD);

    assertThat(login.statusCode()).isEqualTo(200);
    JsonNode body = objectMapper.readTree(login.body());
    assertThat(body.path("user").path("id").asText()).isEqualTo("u1");
    assertThat(body.path("user").has("passwordDigest")).isFalse();
    assertThat(body.has("tokenId")).isFalse();
    String token = body.path("accessToken").asText();

    HttpResponse<String> me = get("/auth/me", token);

    assertThat(me.statusCode()).isEqualTo(200);
    JsonNode principal = objectMapper.readTree(me.body());
    assertThat(principal.path("userId").asText()).isEqualTo("u1");
    assertThat(principal.path("email").asText()).isEqualTo("alice@example.com");
    assertThat(principal.path("role").asText()).isEqualTo("USER");
  }

  @Test
  void login_wrongPassword_returns401() throws Exception {
    HttpResponse<String> response = login("alice@example.com", "wrong-password");

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).contains("Invalid email or password");
  }

  @Test
  void login_unknownEmail_returnsSame401AsWrongPassword() throws Exception {
    HttpResponse<String> unknown = login("nobody@example.com", "wrong-password");
    HttpResponse<String> wrong = login("alice@example.com", "wrong-password");

    assertThat(unknown.statusCode()).isEqualTo(401);
    assertThat(unknown.body()).isEqualTo(wrong.body());
  }

  @Test
  void login_inactiveAccount_returns401() throws Exception {
    HttpResponse<String> response = login("carol@example.com", TollgateTestApplication.PASSWORD);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).contains("Account is inactive");
  }

  @Test
  void login_blankPassword_returns400() throws Exception {
    HttpResponse<String> response = login("alice@example.com", "");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(objectMapper.readTree(response.body()).path("error").asText()).isEqualTo("BAD_REQUEST");
  }

  @Test
  void hostControllerException_notMappedByTollgateAdvice() throws Exception {
    HttpResponse<String> response = get("/api/admin/staff/broken", accessToken("alice@example.com"));

    assertThat(response.statusCode()).isEqualTo(500);
    assertThat(response.body()).doesNotContain("internal detail from the host application");
  }

  @Test
  void me_noToken_returns401() throws Exception {
    HttpResponse<String> response = get("/auth/me", null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).isEqualTo(UNAUTHORIZED_BODY);
  }

  @Test
  void me_bogusToken_returns401() throws Exception {
    HttpResponse<String> response = get("/auth/me", "not-a-real-token");

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).isEqualTo(UNAUTHORIZED_BODY);
  }

  @Test
  void me_signedTokenWithoutSession_returns401() throws Exception {
    String token = tokenIssuer.issue("u1", "alice@example.com").token();

    HttpResponse<String> response = get("/auth/me", token);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).isEqualTo(UNAUTHORIZED_BODY);
  }

  @Test
  void logout_thenReuseToken_returns401() throws Exception {
    String token = accessToken("alice@example.com");

    HttpResponse<String> logout = post("/auth/logout", token, "");
    assertThat(logout.statusCode()).isEqualTo(204);

    HttpResponse<String> reuse = get("/auth/me", token);
    assertThat(reuse.statusCode()).isEqualTo(401);
    assertThat(reuse.body()).isEqualTo(UNAUTHORIZED_BODY);
  }

  @Test
  void logout_withoutToken_returns401() throws Exception {
    assertThat(post("/auth/logout", null, "").statusCode()).isEqualTo(401);
  }

  @Test
  void adminRoute_userRole_returns403() throws Exception {
    HttpResponse<String> response = get("/api/admin", accessToken("alice@example.com"));

    assertThat(response.statusCode()).isEqualTo(403);
    assertThat(response.body()).isEqualTo(FORBIDDEN_BODY);
  }

  @Test
  void adminRoute_adminRole_returns200() throws Exception {
    HttpResponse<String> response = get("/api/admin", accessToken("admin@example.com"));

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("u2");
  }

  @Test
  void methodLevelRoles_overrideClassLevel() throws Exception {
    HttpResponse<String> response = get("/api/admin/staff", accessToken("alice@example.com"));

    assertThat(response.statusCode()).isEqualTo(200);
  }

  @Test
  void adminRoute_noToken_returns401Not403() throws Exception {
    assertThat(get("/api/admin", null).statusCode()).isEqualTo(401);
  }

  @Test
  void health_isPublicAndUp() throws Exception {
    HttpResponse<String> response = get("/actuator/health", null);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"sessionStore\"").contains("UP");
  }

  private String accessToken(String email) throws Exception {
    HttpResponse<String> response = login(email, TollgateTestApplication.PASSWORD);
    assertThat(response.statusCode()).isEqualTo(200);
    return objectMapper.readTree(response.body()).path("accessToken").asText();
  }

  private HttpResponse<String> login(String email, String password) throws Exception {
    String body = objectMapper.writeValueAsString(Map.of("email", email, "password", password));
    return post("/auth/login", null, body);
  }

  private HttpResponse<String> get(String path, String token) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .GET();
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> post(String path, String token, String json) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json));
    if (token != null) {
      builder.header("Authorization", "Bearer " + token);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", port);
  }
}
