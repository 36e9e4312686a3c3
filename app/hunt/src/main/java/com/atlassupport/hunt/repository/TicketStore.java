/*
 * どこで: Hunt Repository 層
 * 何を: チケットの永続化操作を抽象化する
 * なぜ: 保存方式の詳細を Engine / Service から切り離すため
 */
package com.atlassupport.hunt.repository;

import com.atlassupport.hunt.model.Ticket;
import com.atlassupport.hunt.model.TicketStatus;
import java.util.List;
import java.util.Optional;

public interface TicketStore {

  /**
   * 役割: ticketId からチケットを取得する。
   * 動作: 未登録なら empty を返す。
   * 前提: ticketId は空でないこと。
   */
  Optional<Ticket> findById(String ticketId);

  /**
   * 役割: チケットを追加/更新する。
   * 動作: 永続化が完了してから返り、失敗時は StoreUnavailableException を送出する。
   * 前提: 同一 ticketId の更新はチケットロック内で行うこと。
   */
  Ticket save(Ticket ticket);

  List<Ticket> listAll();

  /**
   * 役割: 指定状態のチケットを返す。
   * 動作: 再起動時の Hunt 再開対象の抽出に使う。
   * 前提: status は null でないこと。
   */
  List<Ticket> listByStatus(TicketStatus status);
}
