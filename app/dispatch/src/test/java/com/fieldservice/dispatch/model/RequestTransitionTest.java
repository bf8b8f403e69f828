package com.fieldservice.dispatch.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequestTransitionTest {

  @Test
  void happyPathTransitionsChainWithoutSkipping() {
    assertThat(RequestTransition.ACCEPT.permitsFrom(RequestStatus.PENDING)).isTrue();
    assertThat(RequestTransition.ACCEPT.target()).isEqualTo(RequestStatus.ACCEPTED);
    assertThat(RequestTransition.START.permitsFrom(RequestStatus.ACCEPTED)).isTrue();
    assertThat(RequestTransition.START.target()).isEqualTo(RequestStatus.IN_PROGRESS);
    assertThat(RequestTransition.COMPLETE.permitsFrom(RequestStatus.IN_PROGRESS)).isTrue();
    assertThat(RequestTransition.COMPLETE.target()).isEqualTo(RequestStatus.COMPLETED);

    assertThat(RequestTransition.START.permitsFrom(RequestStatus.PENDING)).isFalse();
    assertThat(RequestTransition.COMPLETE.permitsFrom(RequestStatus.PENDING)).isFalse();
    assertThat(RequestTransition.COMPLETE.permitsFrom(RequestStatus.ACCEPTED)).isFalse();
  }

  @Test
  void cancelIsReachableOnlyFromNonTerminalStates() {
    assertThat(RequestTransition.CANCEL.permitsFrom(RequestStatus.PENDING)).isTrue();
    assertThat(RequestTransition.CANCEL.permitsFrom(RequestStatus.ACCEPTED)).isTrue();
    assertThat(RequestTransition.CANCEL.permitsFrom(RequestStatus.IN_PROGRESS)).isTrue();
    assertThat(RequestTransition.CANCEL.permitsFrom(RequestStatus.COMPLETED)).isFalse();
    assertThat(RequestTransition.CANCEL.permitsFrom(RequestStatus.CANCELLED)).isFalse();
  }

  @Test
  void terminalStatesAcceptNoTransition() {
    for (RequestStatus terminal : RequestStatus.FINISHED) {
      for (RequestTransition transition : RequestTransition.values()) {
        assertThat(transition.permitsFrom(terminal)).as("%s from %s", transition, terminal).isFalse();
      }
    }
  }

  @Test
  void rolesMatchTransitionTable() {
    assertThat(RequestTransition.ACCEPT.permitsRole(ActorRole.WORKER)).isTrue();
    assertThat(RequestTransition.ACCEPT.permitsRole(ActorRole.CUSTOMER)).isFalse();
    assertThat(RequestTransition.ACCEPT.permitsRole(ActorRole.ADMIN)).isFalse();
    assertThat(RequestTransition.COMPLETE.permitsRole(ActorRole.ADMIN)).isFalse();
    assertThat(RequestTransition.CANCEL.permitsRole(ActorRole.CUSTOMER)).isTrue();
    assertThat(RequestTransition.CANCEL.permitsRole(ActorRole.ADMIN)).isTrue();
    assertThat(RequestTransition.CANCEL.permitsRole(ActorRole.WORKER)).isTrue();
  }
}
