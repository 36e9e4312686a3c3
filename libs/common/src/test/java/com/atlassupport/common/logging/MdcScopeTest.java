package com.atlassupport.common.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcScopeTest {

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void withTraceAddsTraceIdAndRemovesOnClose() {
    try (MdcScope ignored = MdcScope.withTrace("ticket_id", "ticket-1")) {
      assertThat(MDC.get("ticket_id")).isEqualTo("ticket-1");
      assertThat(MDC.get(MdcScope.TRACE_ID)).isNotBlank();
    }

    assertThat(MDC.get("ticket_id")).isNull();
    assertThat(MDC.get(MdcScope.TRACE_ID)).isNull();
  }

  @Test
  void withTraceKeepsExistingTraceId() {
    MDC.put(MdcScope.TRACE_ID, "req-1");

    try (MdcScope ignored = MdcScope.withTrace("ticket_id", "ticket-1")) {
      assertThat(MDC.get(MdcScope.TRACE_ID)).isEqualTo("req-1");
    }

    assertThat(MDC.get(MdcScope.TRACE_ID)).isEqualTo("req-1");
  }

  @Test
  void openRestoresPreviousValueAndIgnoresBlank() {
    MDC.put("ticket_id", "outer");

    try (MdcScope ignored = MdcScope.open(Map.of("ticket_id", "inner", "expert_id", " "))) {
      assertThat(MDC.get("ticket_id")).isEqualTo("inner");
      assertThat(MDC.get("expert_id")).isNull();
    }

    assertThat(MDC.get("ticket_id")).isEqualTo("outer");
  }
}
