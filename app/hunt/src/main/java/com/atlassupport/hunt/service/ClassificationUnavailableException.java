/*
 * どこで: Hunt サービス層
 * 何を: 分類器の依存先障害を表現する
 * なぜ: 依頼を落とさず既定値へ縮退させる分岐を呼び出し側で明示するため
 */
package com.atlassupport.hunt.service;

public class ClassificationUnavailableException extends RuntimeException {
  public ClassificationUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
