/*
 * どこで: Hunt ドメインモデル
 * 何を: 分類器が返す依頼カテゴリを定義する
 * なぜ: 文字列ではなく閉じた列挙として扱い、追加時にコンパイラで検出できるようにするため
 */
package com.atlassupport.hunt.model;

public enum RequestCategory {
  GENERAL_QUESTION,
  TECHNICAL_ISSUE,
  URGENT_ISSUE,
  ACCESS_REQUEST,
  FEATURE_REQUEST,
  FEEDBACK,
  OTHER
}
