/*
 * どこで: Hunt サービス層
 * 何を: 依頼本文から緊急度/必要タグ/カテゴリ/下書き返信を得る抽象化インターフェース
 * なぜ: LLM 連携を外部実装として差し替え可能にするため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.model.Classification;

public interface UrgencyClassifier {

  /**
   * 役割: 依頼を分類する。
   * 動作: 分類結果を返す。依存先が使えない場合は ClassificationUnavailableException を送出する。
   * 前提: rawText は空でないこと。
   */
  Classification classify(String rawText, String requesterId);
}
