/*
 * どこで: Dispatch 設定バインドのバリデーションテスト
 * 何を: dispatch.nats の必須設定を検証する
 * なぜ: 起動時に設定不備を検知して publish 時の失敗を防ぐため
 */
package com.fieldservice.dispatch.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.assertj.core.util.Throwables;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class DispatchNatsPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextFailsWhenSubjectIsMissing() {
    contextRunner
        .withPropertyValues(
            "dispatch.nats.stream=dispatch-request-lifecycle",
            "dispatch.nats.duplicate-window=2m")
        .run(assertValidationFailure("subject"));
  }

  @Test
  void contextFailsWhenStreamIsBlank() {
    // 空白のみも NotBlank で弾く
    contextRunner
        .withPropertyValues(
            "dispatch.nats.subject=dispatch.request.lifecycle",
            "dispatch.nats.stream=   ",
            "dispatch.nats.duplicate-window=2m")
        .run(assertValidationFailure("stream"));
  }

  @Test
  void contextFailsWhenDuplicateWindowIsMissing() {
    contextRunner
        .withPropertyValues(
            "dispatch.nats.subject=dispatch.request.lifecycle",
            "dispatch.nats.stream=dispatch-request-lifecycle")
        .run(assertValidationFailure("duplicate"));
  }

  @Test
  void contextStartsWithCompleteSettings() {
    contextRunner
        .withPropertyValues(
            "dispatch.nats.subject=dispatch.request.lifecycle",
            "dispatch.nats.stream=dispatch-request-lifecycle",
            "dispatch.nats.duplicate-window=2m")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final DispatchNatsProperties properties =
                  context.getBean(DispatchNatsProperties.class);
              assertThat(properties.subject()).isEqualTo("dispatch.request.lifecycle");
              assertThat(properties.stream()).isEqualTo("dispatch-request-lifecycle");
              assertThat(properties.duplicateWindow()).hasMinutes(2);
            });
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedField) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root = Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedField);
    };
  }

  @Configuration
  @EnableConfigurationProperties(DispatchNatsProperties.class)
  static class TestConfiguration {}
}
