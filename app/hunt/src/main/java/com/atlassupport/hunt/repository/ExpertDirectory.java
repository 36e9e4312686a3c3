/*
 * どこで: Hunt Repository 層
 * 何を: 専門家と依頼者優先度の読み書きを抽象化する
 * なぜ: 永続化方式をエンジンから切り離し、テストで差し替えやすくするため
 */
package com.atlassupport.hunt.repository;

import com.atlassupport.hunt.model.Expert;
import com.atlassupport.hunt.model.UserPriority;
import java.util.List;
import java.util.Optional;

public interface ExpertDirectory {

  /**
   * 役割: 専門家を id で取得する。
   * 動作: 未登録なら empty を返す。
   * 前提: expertId は空でないこと。
   */
  Optional<Expert> findExpert(String expertId);

  /**
   * 役割: 専門家レコードを保存する。
   * 動作: 永続化が完了してから返り、失敗時は StoreUnavailableException を送出する。
   * 前提: currentLoad の排他は呼び出し側の専門家ロックで行うこと。
   */
  Expert saveExpert(Expert expert);

  /**
   * 役割: 全専門家のスナップショットを返す。
   * 動作: id 昇順の不変リストを返す。
   * 前提: なし。
   */
  List<Expert> listExperts();

  Optional<UserPriority> findUserPriority(String userId);

  UserPriority saveUserPriority(UserPriority userPriority);

  List<UserPriority> listUserPriorities();
}
