package com.example.auth_gateway.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class ServletAuthAdaptersTest {

  @Test
  void requestKeepsFirstCookieOfAName() {
    final MockHttpServletRequest servletRequest = new MockHttpServletRequest();
    servletRequest.setCookies(new Cookie("state", "first"), new Cookie("state", "second"));
    servletRequest.addParameter("returnTo", "/a", "/b");

    final ServletAuthRequest request = new ServletAuthRequest(servletRequest);

    assertThat(request.getCookies()).containsEntry("state", "first");
    assertThat(request.getParameterValues("returnTo")).containsExactly("/a", "/b");
    assertThat(request.getFirstParameter("returnTo")).contains("/a");
    assertThat(request.getFirstParameter("missing")).isEmpty();
  }

  @Test
  void responseWritesCookieAttributes() {
    final MockHttpServletResponse servletResponse = new MockHttpServletResponse();
    final ServletAuthResponse response = new ServletAuthResponse(servletResponse);

    response.setCookie(
        "nonce", "v.sig", new CookieAttributes(true, true, "acme.com", "/", SameSite.NONE));
    response.setCookie("_nonce", "v.sig2", new CookieAttributes(true, false, null, null, null));

    assertThat(servletResponse.getHeaders("Set-Cookie"))
        .containsExactly(
            "nonce=v.sig; Path=/; Domain=acme.com; Secure; HttpOnly; SameSite=None",
            "_nonce=v.sig2; Path=/; HttpOnly");
  }

  @Test
  void clearCookieExpiresIt() {
    final MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    new ServletAuthResponse(servletResponse)
        .clearCookie("state", new CookieAttributes(true, false, null, "/", SameSite.LAX));

    assertThat(servletResponse.getCookie("state").getMaxAge()).isZero();
    assertThat(servletResponse.getHeader("Set-Cookie")).contains("Max-Age=0");
  }

  @Test
  void redirectSetsFoundAndLocation() {
    final MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    new ServletAuthResponse(servletResponse).redirect("https://op.example.com/authorize");

    assertThat(servletResponse.getStatus()).isEqualTo(302);
    assertThat(servletResponse.getHeader("Location")).isEqualTo("https://op.example.com/authorize");
  }

  @Test
  void sameSiteParsesCaseInsensitively() {
    assertThat(SameSite.from("lax")).isEqualTo(SameSite.LAX);
    assertThat(SameSite.from(" None ")).isEqualTo(SameSite.NONE);
    assertThatThrownBy(() -> SameSite.from("")).isInstanceOf(IllegalArgumentException.class);
  }
}
