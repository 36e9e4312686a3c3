/*
 * どこで: Hunt API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.atlassupport.hunt.api;

public class InvalidSupportRequestException extends RuntimeException {
  public InvalidSupportRequestException(String message) {
    super(message);
  }
}
