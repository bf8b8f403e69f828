/*
 * どこで: Dispatch サービス層
 * 何を: 「誰がどの依頼に何をしてよいか」の判定を 1 箇所に集約する
 * なぜ: 操作ごとに権限判定が散らばると、遷移表との食い違いが起きやすいため
 */
package com.fieldservice.dispatch.service;

import com.fieldservice.dispatch.exception.DispatchAccessDeniedException;
import com.fieldservice.dispatch.exception.InvalidRequestTransitionException;
import com.fieldservice.dispatch.exception.RequestAlreadyAssignedException;
import com.fieldservice.dispatch.model.Actor;
import com.fieldservice.dispatch.model.ActorRole;
import com.fieldservice.dispatch.model.RequestTransition;
import com.fieldservice.dispatch.model.ServiceRequestRecord;
import org.springframework.stereotype.Component;

@Component
public class DispatchAuthorizationPolicy {

  /**
   * 役割: 遷移の可否を判定し、不可なら型付きの失敗を投げる。
   * 動作: ロール → 現在状態 → 所有/担当関係の順に判定する。
   * 受諾済み依頼への accept は InvalidTransition ではなく AlreadyAssigned とする。
   * 前提: request は判定直前に読み出したスナップショットであること。
   */
  public void authorizeTransition(
      RequestTransition transition, Actor actor, ServiceRequestRecord request) {
    if (!transition.permitsRole(actor.role())) {
      throw new DispatchAccessDeniedException(
          actor.role().name() + " may not " + transition.value() + " requests");
    }
    if (!transition.permitsFrom(request.status())) {
      if (transition == RequestTransition.ACCEPT && request.status().hasAssignee()) {
        throw new RequestAlreadyAssignedException(request.requestId());
      }
      throw new InvalidRequestTransitionException(
          request.requestId(), transition.value(), request.status());
    }
    if (!isParticipant(transition, actor, request)) {
      throw new DispatchAccessDeniedException(
          "actor " + actor.id() + " may not " + transition.value() + " request "
              + request.requestId());
    }
  }

  public void requireRole(Actor actor, ActorRole role, String operation) {
    if (!actor.is(role)) {
      throw new DispatchAccessDeniedException(operation + " requires role " + role.name());
    }
  }

  /** 作業者本人または管理者のみ許可する。 */
  public void requireSelfOrAdmin(Actor actor, String workerId, String operation) {
    if (actor.is(ActorRole.ADMIN)) {
      return;
    }
    if (!actor.is(ActorRole.WORKER) || !actor.id().equals(workerId)) {
      throw new DispatchAccessDeniedException(
          "actor " + actor.id() + " may not " + operation + " for worker " + workerId);
    }
  }

  /** 依頼を作成した顧客か管理者のみ許可する。 */
  public void requireOwnerOrAdmin(Actor actor, ServiceRequestRecord request, String operation) {
    final boolean allowed =
        actor.is(ActorRole.ADMIN)
            || (actor.is(ActorRole.CUSTOMER) && actor.id().equals(request.customerId()));
    if (!allowed) {
      throw new DispatchAccessDeniedException(
          "actor " + actor.id() + " may not " + operation + " for request " + request.requestId());
    }
  }

  /** 依頼の参照権: 作成した顧客、担当 (または最後の担当) 作業者、管理者。 */
  public void requireViewer(Actor actor, ServiceRequestRecord request) {
    final boolean allowed =
        switch (actor.role()) {
          case ADMIN -> true;
          case CUSTOMER -> actor.id().equals(request.customerId());
          case WORKER ->
              request.isAssignedTo(actor.id())
                  || actor.id().equals(request.lastAssignedWorkerId());
        };
    if (!allowed) {
      throw new DispatchAccessDeniedException(
          "actor " + actor.id() + " may not view request " + request.requestId());
    }
  }

  private boolean isParticipant(
      RequestTransition transition, Actor actor, ServiceRequestRecord request) {
    return switch (transition) {
      case ACCEPT -> true;
      case START, COMPLETE -> request.isAssignedTo(actor.id());
      case CANCEL ->
          switch (actor.role()) {
            case ADMIN -> true;
            case CUSTOMER -> actor.id().equals(request.customerId());
            case WORKER -> request.isAssignedTo(actor.id());
          };
    };
  }
}
