/*
 * どこで: Common ログ補助
 * 何を: 一時的に MDC キーを設定し、close 時に元の値へ戻すスコープを提供する
 * なぜ: スケジューラスレッド上の Hunt 処理でも ticket_id / trace_id をログへ載せるため
 */
package com.atlassupport.common.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;

public final class MdcScope implements AutoCloseable {

  public static final String TRACE_ID = "trace_id";

  private final Map<String, String> previous = new LinkedHashMap<>();

  private MdcScope() {}

  /**
   * 役割: 指定キーを MDC へ積む。
   * 動作: null/空値のキーは無視し、上書き前の値を保持して close 時に復元する。
   * 前提: try-with-resources で利用すること。
   */
  public static MdcScope open(Map<String, String> values) {
    final MdcScope scope = new MdcScope();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      scope.put(entry.getKey(), entry.getValue());
    }
    return scope;
  }

  /** trace_id が未設定なら新規採番し、key/value と一緒に積む。 */
  public static MdcScope withTrace(String key, String value) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put(key, value);
    final String traceId = MDC.get(TRACE_ID);
    values.put(TRACE_ID, traceId == null || traceId.isBlank() ? newTraceId() : traceId);
    return open(values);
  }

  private static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  private void put(String key, String value) {
    if (key == null || value == null || value.isBlank()) {
      return;
    }
    previous.put(key, MDC.get(key));
    MDC.put(key, value);
  }

  @Override
  public void close() {
    for (Map.Entry<String, String> entry : previous.entrySet()) {
      if (entry.getValue() == null) {
        MDC.remove(entry.getKey());
      } else {
        MDC.put(entry.getKey(), entry.getValue());
      }
    }
  }
}
