/*
 * どこで: Dispatch NATS 初期化
 * 何を: ライフサイクルイベント用の JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.fieldservice.dispatch.nats;

import com.fieldservice.dispatch.config.DispatchNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DispatchJetStreamBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(DispatchJetStreamBootstrap.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final DispatchNatsProperties properties;

    @PostConstruct
    public void start() {
        if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
            throw new IllegalStateException("dispatch.nats.duplicate-window must be positive");
        }
        try {
            StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                    .name(properties.stream())
                    .subjects(properties.subject())
                    .duplicateWindow(properties.duplicateWindow())
                    .build();
            JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
            upsertStream(jetStreamManagement, streamConfiguration);
            logger.info("dispatch stream ensured stream={} subject={} duplicateWindow={}",
                    properties.stream(),
                    properties.subject(),
                    properties.duplicateWindow());
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure JetStream stream", ex);
        }
    }

    private void upsertStream(JetStreamManagement jetStreamManagement,
            StreamConfiguration streamConfiguration) throws IOException, JetStreamApiException {
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }

    private boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }
}
