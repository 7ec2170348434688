package com.example.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.auth_gateway.config.TestAuthProperties;
import com.example.auth_gateway.model.OidcProviderMetadata;
import com.example.auth_gateway.model.TokenSet;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class DiscoveryOidcClientTest {

  private static final String DISCOVERY_URL =
      "https://op.example.com/.well-known/openid-configuration";
  private static final String DISCOVERY_BODY =
      """
      {
        "issuer": "https://op.example.com/",
        "authorization_endpoint": "https://op.example.com/authorize",
        "token_endpoint": "https://op.example.com/oauth/token",
        "end_session_endpoint": "https://op.example.com/logout",
        "jwks_uri": "https://op.example.com/.well-known/jwks.json"
      }
      """;

  @Test
  void authorizationUrlPutsClientIdFirstAndEncodesParameters() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("response_type", "code");
    params.put("scope", "openid profile");
    params.put("redirect_uri", "http://www.acme.com/api/auth/callback");
    params.put("client_id", "ignored");

    final String url = fixture.client.authorizationUrl(params);

    assertThat(url)
        .isEqualTo(
            "https://op.example.com/authorize?client_id=__test_client_id__&response_type=code"
                + "&scope=openid+profile&redirect_uri=http%3A%2F%2Fwww.acme.com%2Fapi%2Fauth%2Fcallback");
    fixture.server.verify();
  }

  @Test
  void discoveryDocumentIsReadFromIssuerWellKnownPath() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);

    final OidcProviderMetadata metadata = fixture.client.metadata();

    assertThat(metadata.issuer()).isEqualTo("https://op.example.com/");
    assertThat(metadata.tokenEndpoint()).isEqualTo("https://op.example.com/oauth/token");
    assertThat(metadata.endSessionEndpoint()).isEqualTo("https://op.example.com/logout");
    fixture.server.verify();
  }

  @Test
  void discoveryDocumentIsFetchedOnce() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);

    fixture.client.authorizationUrl(Map.of());
    fixture.client.endSessionUrl(Map.of("post_logout_redirect_uri", "http://www.acme.com"));

    fixture.server.verify();
  }

  @Test
  void endSessionUrlRequiresAdvertisedEndpoint() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(
        fixture,
        """
        {
          "issuer": "https://op.example.com/",
          "authorization_endpoint": "https://op.example.com/authorize",
          "token_endpoint": "https://op.example.com/oauth/token"
        }
        """);

    assertThatThrownBy(() -> fixture.client.endSessionUrl(Map.of()))
        .isInstanceOfSatisfying(
            OidcIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(OidcIntegrationException.Reason.INVALID_RESPONSE));
  }

  @Test
  void discoveryServerErrorIsBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(DISCOVERY_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.authorizationUrl(Map.of()))
        .isInstanceOfSatisfying(
            OidcIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(OidcIntegrationException.Reason.BAD_GATEWAY));
  }

  @Test
  void discoveryWithoutEndpointsIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, "{\"issuer\":\"https://op.example.com/\"}");

    assertThatThrownBy(() -> fixture.client.authorizationUrl(Map.of()))
        .isInstanceOf(OidcIntegrationException.class)
        .hasMessage("discovery document is invalid");
  }

  @Test
  void exchangeCodePostsFormAndReadsTokens() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);
    fixture
        .server
        .expect(requestTo("https://op.example.com/oauth/token"))
        .andExpect(method(POST))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "grant_type", "authorization_code",
                        "code", "code-1",
                        "redirect_uri", "http://www.acme.com/api/auth/callback",
                        "code_verifier", "verifier-1",
                        "client_id", "__test_client_id__",
                        "client_secret", "client-secret-1")))
        .andRespond(
            withSuccess(
                """
                {"id_token":"h.p.s","access_token":"at-1","token_type":"Bearer","expires_in":300}
                """,
                MediaType.APPLICATION_JSON));

    final TokenSet tokenSet =
        fixture.client.exchangeCode(
            "code-1", "http://www.acme.com/api/auth/callback", "verifier-1");

    assertThat(tokenSet.idToken()).isEqualTo("h.p.s");
    assertThat(tokenSet.accessToken()).isEqualTo("at-1");
    assertThat(tokenSet.expiresIn()).isEqualTo(300L);
    fixture.server.verify();
  }

  @Test
  void rejectedCodeIsReportedAsRejected() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);
    fixture
        .server
        .expect(requestTo("https://op.example.com/oauth/token"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid_grant\"}"));

    assertThatThrownBy(() -> fixture.client.exchangeCode("code-1", "http://cb", "v"))
        .isInstanceOfSatisfying(
            OidcIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(OidcIntegrationException.Reason.REJECTED));
  }

  @Test
  void tokenResponseWithoutIdTokenIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);
    fixture
        .server
        .expect(requestTo("https://op.example.com/oauth/token"))
        .andRespond(withSuccess("{\"access_token\":\"at-1\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.exchangeCode("code-1", "http://cb", "v"))
        .isInstanceOf(OidcIntegrationException.class)
        .hasMessage("token response has no id_token");
  }

  @Test
  void tokenTimeoutIsReportedAsTimeout() {
    final ClientFixture fixture = newFixture();
    expectDiscovery(fixture, DISCOVERY_BODY);
    fixture
        .server
        .expect(requestTo("https://op.example.com/oauth/token"))
        .andRespond(withException(new SocketTimeoutException("Read timed out")));

    assertThatThrownBy(() -> fixture.client.exchangeCode("code-1", "http://cb", "v"))
        .isInstanceOfSatisfying(
            OidcIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(OidcIntegrationException.Reason.TIMEOUT));
  }

  @Test
  void connectionFailureIsBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(DISCOVERY_URL))
        .andRespond(withException(new ConnectException("Connection refused")));

    assertThatThrownBy(() -> fixture.client.authorizationUrl(Map.of()))
        .isInstanceOfSatisfying(
            OidcIntegrationException.class,
            ex -> assertThat(ex.reason()).isEqualTo(OidcIntegrationException.Reason.BAD_GATEWAY));
  }

  @Test
  void exchangeCodeRequiresCode() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.exchangeCode(" ", "http://cb", "v"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("code is required");
  }

  private void expectDiscovery(ClientFixture fixture, String body) {
    fixture
        .server
        .expect(requestTo(DISCOVERY_URL))
        .andExpect(method(GET))
        .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.build();
    return new ClientFixture(
        new DiscoveryOidcClient(
            restClient,
            TestAuthProperties.builder()
                .issuerBaseUrl("https://op.example.com/")
                .clientSecret("client-secret-1")
                .build()),
        server);
  }

  private record ClientFixture(DiscoveryOidcClient client, MockRestServiceServer server) {}
}
