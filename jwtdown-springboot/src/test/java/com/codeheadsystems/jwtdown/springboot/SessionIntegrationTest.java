package com.codeheadsystems.jwtdown.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.jwtdown.server.auth.HmacAlgorithm;
import com.codeheadsystems.jwtdown.server.auth.TokenCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SessionIntegrationTest {

  private static final String COOKIE = "jwtdown_access_token";
  private static final String PASSWORD = "correct-horse-battery-staple";
  private static final String LOCAL_ORIGIN = "http://localhost:3000";
  private static final String REMOTE_ORIGIN = "https://app.example.com";

  @LocalServerPort
  private int port;

  @Autowired
  private ObjectMapper objectMapper;

  @Autowired
  private TokenCodec tokenCodec;

  private HttpClient httpClient;
  private String username;

  @BeforeEach
  void setUp() throws Exception {
    httpClient = HttpClient.newHttpClient();
    // The user store lives as long as the context, so each test gets its own account.
    username = "alice-" + UUID.randomUUID();
    assertThat(signup(username, PASSWORD).statusCode()).isEqualTo(200);
  }

  @Test
  void loginThenCallProtectedEndpointWithBearer_returnsUser() throws Exception {
    HttpResponse<String> login = login(username, PASSWORD, null);
    assertThat(login.statusCode()).isEqualTo(200);
    JsonNode body = objectMapper.readTree(login.body());
    assertThat(body.get("token_type").asText()).isEqualTo("bearer");
    String token = body.get("access_token").asText();

    HttpResponse<String> me = send(HttpRequest.newBuilder(uri("/users/me"))
        .header("Authorization", "Bearer " + token)
        .GET());

    assertThat(me.statusCode()).isEqualTo(200);
    JsonNode user = objectMapper.readTree(me.body());
    assertThat(user.get("username").asText()).isEqualTo(username);
    assertThat(user.get("id").asInt()).isPositive();
    assertThat(user.get("email").asText()).isEqualTo(username + "@example.com");
  }

  @Test
  void loginThenCallProtectedEndpointWithCookie_returnsUser() throws Exception {
    String token = accessToken(login(username, PASSWORD, LOCAL_ORIGIN));

    HttpResponse<String> me = send(HttpRequest.newBuilder(uri("/users/me"))
        .header("Cookie", COOKIE + "=" + token)
        .GET());

    assertThat(me.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(me.body()).get("username").asText()).isEqualTo(username);
  }

  @Test
  void login_cookieCarriesSameTokenAsBody() throws Exception {
    HttpResponse<String> login = login(username, PASSWORD, LOCAL_ORIGIN);

    assertThat(setCookie(login)).startsWith(COOKIE + "=" + accessToken(login) + ";");
  }

  @Test
  void login_localOrigin_setsLaxNonSecureCookie() throws Exception {
    String cookie = setCookie(login(username, PASSWORD, LOCAL_ORIGIN));

    assertThat(cookie).contains("HttpOnly").contains("SameSite=Lax").contains("Path=/").doesNotContain("Secure");
  }

  @Test
  void login_remoteOrigin_setsSecureCrossSiteCookie() throws Exception {
    String cookie = setCookie(login(username, PASSWORD, REMOTE_ORIGIN));

    assertThat(cookie).contains("HttpOnly").contains("Secure").contains("SameSite=None");
  }

  @Test
  void login_wrongPassword_returns401WithChallenge() throws Exception {
    HttpResponse<String> response = login(username, "wrong", null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Bearer");
    assertThat(objectMapper.readTree(response.body()).get("detail").asText())
        .isEqualTo("Invalid authentication credentials");
    assertThat(response.headers().firstValue("Set-Cookie")).isEmpty();
  }

  @Test
  void login_unknownUser_returnsSame401() throws Exception {
    HttpResponse<String> response = login("nobody-" + UUID.randomUUID(), PASSWORD, null);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(objectMapper.readTree(response.body()).get("detail").asText())
        .isEqualTo("Invalid authentication credentials");
  }

  @Test
  void callProtectedEndpoint_noToken_returns401() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/users/me")).GET());

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).contains("Bearer");
    assertThat(objectMapper.readTree(response.body()).get("detail").asText())
        .isEqualTo("Invalid authentication credentials");
  }

  @Test
  void callProtectedEndpoint_bogusToken_returns401() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/users/me"))
        .header("Authorization", "Bearer not-a-real-token")
        .GET());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void callProtectedEndpoint_badHeaderAndGoodCookie_returns401() throws Exception {
    String token = accessToken(login(username, PASSWORD, null));

    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/users/me"))
        .header("Authorization", "Bearer not-a-real-token")
        .header("Cookie", COOKIE + "=" + token)
        .GET());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void callProtectedEndpoint_tokenForUnknownUser_returns401() throws Exception {
    String token = tokenCodec.issueForSubject("ghost-" + UUID.randomUUID());

    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/users/me"))
        .header("Authorization", "Bearer " + token)
        .GET());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void readToken_withCookie_echoesToken() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/token"))
        .header("Cookie", COOKIE + "=abc.def.ghi")
        .GET());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(response.body()).get("token").asText()).isEqualTo("abc.def.ghi");
  }

  @Test
  void readToken_withoutCookie_returnsEmptyBody() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/token")).GET());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEmpty();
  }

  @Test
  void validate_ownToken_returnsClaims() throws Exception {
    String token = accessToken(login(username, PASSWORD, null));

    HttpResponse<String> response = validate(token);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(response.body()).get("sub").asText()).isEqualTo(username);
  }

  @Test
  void validate_foreignToken_returns422() throws Exception {
    String foreign = new TokenCodec("another-secret-that-is-32-bytes-long".getBytes(StandardCharsets.UTF_8),
        HmacAlgorithm.HS256).issueForSubject(username);

    HttpResponse<String> response = validate(foreign);

    assertThat(response.statusCode()).isEqualTo(422);
    assertThat(objectMapper.readTree(response.body()).get("detail").asText()).isEqualTo("invalid token");
  }

  @Test
  void logout_clearsCookieWithMatchingAttributes() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/token"))
        .header("Origin", REMOTE_ORIGIN)
        .DELETE());

    assertThat(response.statusCode()).isEqualTo(200);
    String cookie = setCookie(response);
    assertThat(cookie).startsWith(COOKIE + "=;").contains("Max-Age=0").contains("Secure").contains("SameSite=None");
  }

  @Test
  void logout_withoutSession_succeeds() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/token"))
        .header("Origin", LOCAL_ORIGIN)
        .DELETE());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(setCookie(response)).contains("Max-Age=0").contains("SameSite=Lax");
  }

  @Test
  void signup_duplicateUsername_returns409() throws Exception {
    HttpResponse<String> response = signup(username, "another-password");

    assertThat(response.statusCode()).isEqualTo(409);
    // The original password still works.
    assertThat(login(username, PASSWORD, null).statusCode()).isEqualTo(200);
  }

  @Test
  void signup_missingPassword_returns400() throws Exception {
    String json = objectMapper.writeValueAsString(Map.of("username", "nopass-" + UUID.randomUUID()));

    HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/api/users"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json)));

    assertThat(response.statusCode()).isEqualTo(400);
  }

  private HttpResponse<String> signup(String user, String password) throws Exception {
    String json = objectMapper.writeValueAsString(Map.of(
        "username", user,
        "email", user + "@example.com",
        "full_name", "Alice Liddell",
        "password", password));
    return send(HttpRequest.newBuilder(uri("/api/users"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json)));
  }

  private HttpResponse<String> login(String user, String password, String origin) throws Exception {
    String form = "username=" + URLEncoder.encode(user, StandardCharsets.UTF_8)
        + "&password=" + URLEncoder.encode(password, StandardCharsets.UTF_8);
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri("/token"))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form));
    if (origin != null) {
      builder.header("Origin", origin);
    }
    return send(builder);
  }

  private HttpResponse<String> validate(String token) throws Exception {
    String json = objectMapper.writeValueAsString(Map.of("token", token));
    return send(HttpRequest.newBuilder(uri("/token/validate"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json)));
  }

  private String accessToken(HttpResponse<String> login) throws Exception {
    assertThat(login.statusCode()).isEqualTo(200);
    return objectMapper.readTree(login.body()).get("access_token").asText();
  }

  private static String setCookie(HttpResponse<String> response) {
    List<String> cookies = response.headers().allValues("Set-Cookie");
    assertThat(cookies).hasSize(1);
    return cookies.get(0);
  }

  private HttpResponse<String> send(HttpRequest.Builder builder) throws Exception {
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private URI uri(String path) {
    return URI.create(String.format("http://localhost:%d%s", port, path));
  }
}
