/*
 * どこで: Dispatch サービス層
 * 何を: ライフサイクルイベントの配信先を抽象化する
 * なぜ: NATS の有無で実装を切り替え、Coordinator を配信手段から切り離すため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.model.RequestLifecycleEvent;

public interface LifecycleEventPublisher {

  /**
   * 役割: イベントを外部の通知側へ渡す。
   * 動作: 配信完了を待たずに戻る。失敗は実行時例外または非同期のログで表れる。
   * 前提: 呼び出しは状態遷移の確定後であること。
   */
  void publish(RequestLifecycleEvent event);
}
