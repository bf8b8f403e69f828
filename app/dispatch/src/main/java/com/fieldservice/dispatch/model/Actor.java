/*
 * どこで: Dispatch ドメインモデル
 * 何を: 認証済み操作者 (id + ロール) を表す
 * なぜ: 認証は外部の責務とし、エンジンは検証済みの主体だけを受け取るため
 */
package com.fieldservice.dispatch.model;

import com.fieldservice.dispatch.exception.InvalidDispatchRequestException;

public record Actor(String id, ActorRole role) {

  /** 顧客/作業者 id の最大長 (customer_id, worker_id, actor_id 列と同じ)。 */
  public static final int MAX_ID_LENGTH = 64;

  public Actor {
    if (id == null || id.isBlank()) {
      throw new InvalidDispatchRequestException("actor id is required");
    }
    if (id.length() > MAX_ID_LENGTH) {
      throw new InvalidDispatchRequestException(
          "actor id must be at most " + MAX_ID_LENGTH + " characters");
    }
    if (role == null) {
      throw new InvalidDispatchRequestException("actor role is required");
    }
  }

  public static Actor customer(String id) {
    return new Actor(id, ActorRole.CUSTOMER);
  }

  public static Actor worker(String id) {
    return new Actor(id, ActorRole.WORKER);
  }

  public static Actor admin(String id) {
    return new Actor(id, ActorRole.ADMIN);
  }

  public boolean is(ActorRole expected) {
    return role == expected;
  }
}
