/*
 * どこで: Dispatch アプリのインフラ設定
 * 何を: NATS Connection と JetStream を Spring 管理下に置く
 * なぜ: stream 初期化と publisher が同一接続を再利用するため
 */
package com.fieldservice.dispatch.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 2;

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final int timeoutSeconds =
        properties.connectionTimeout() == null
            ? DEFAULT_CONNECTION_TIMEOUT_SECONDS
            : properties.connectionTimeout();
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(timeoutSeconds))
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection natsConnection) throws IOException {
    return natsConnection.jetStream();
  }
}
