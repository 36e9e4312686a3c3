package com.atlassupport.hunt.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/support/tickets/ticket-1/claim");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Expert-Id", "e1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("trace_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/support/tickets/ticket-1/claim");
    assertThat(MDC.get("actor_id")).isEqualTo("e1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("actor_id")).isNull();
  }

  @Test
  void generatesRequestIdAndFallsBackToUserHeader() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/support/requests");
    request.addHeader("X-User-Id", "user-1");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("actor_id")).isEqualTo("user-1");
  }
}
