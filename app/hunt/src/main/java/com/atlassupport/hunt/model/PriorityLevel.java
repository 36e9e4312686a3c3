/*
 * どこで: Hunt ドメインモデル
 * 何を: 依頼者の優先度ティアを定義する
 * なぜ: Matcher と Wave 幅の分岐を列挙型で固定するため
 */
package com.atlassupport.hunt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PriorityLevel {
  VIP("vip"),
  STANDARD("standard"),
  REGULAR("regular");

  private final String value;

  PriorityLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * 役割: 永続化/設定で受け取った level 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: level は null でないことを呼び出し側で保証する。
   */
  @JsonCreator
  public static PriorityLevel fromValue(String level) {
    for (PriorityLevel priorityLevel : values()) {
      if (priorityLevel.value.equalsIgnoreCase(level)) {
        return priorityLevel;
      }
    }
    throw new IllegalArgumentException("unsupported priority level: " + level);
  }
}
