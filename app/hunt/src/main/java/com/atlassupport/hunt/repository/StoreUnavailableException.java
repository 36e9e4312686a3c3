/*
 * どこで: Hunt Repository 層
 * 何を: 永続化の失敗を表現する
 * なぜ: 未永続の状態変更のまま処理を進めず、該当操作を失敗させるため
 */
package com.atlassupport.hunt.repository;

public class StoreUnavailableException extends RuntimeException {
  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
