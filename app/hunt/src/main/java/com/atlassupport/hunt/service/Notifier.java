/*
 * どこで: Hunt サービス層
 * 何を: 専門家への呼び出しと結果通知の抽象化インターフェース
 * なぜ: チャット基盤への実送信を外部実装に任せ、テスト差し替えを容易にするため
 */
package com.atlassupport.hunt.service;

import com.atlassupport.hunt.model.HuntOutcome;
import com.atlassupport.hunt.model.Ticket;
import java.util.Collection;

public interface Notifier {

  /**
   * 役割: 候補専門家 1 名へ呼び出しを届ける。
   * 動作: 成功時 true、失敗時 false を返す(例外を送出してもよい)。
   * 前提: 1 名の失敗で Wave 全体を止めないよう、呼び出し側で個別に扱う。
   */
  boolean notify(String recipient, String ticketId, String message);

  /**
   * 役割: Hunt の結果を関係者へ通知する。
   * 動作: CLAIMED の場合は他の呼び出し済み専門家へ「対応済み」を伝える。
   * 前提: なし。
   */
  void announceOutcome(String ticketId, HuntOutcome outcome, Collection<String> recipients);

  /** 依頼元スレッドへ返信する。 */
  void reply(String threadRef, String message);

  /** 候補が尽きたチケットを既定のフォールバックチャンネルへ流す。 */
  void broadcastFallback(String channel, Ticket ticket);
}
