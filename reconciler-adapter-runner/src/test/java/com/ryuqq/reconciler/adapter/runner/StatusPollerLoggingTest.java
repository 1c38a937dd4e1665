package com.ryuqq.reconciler.adapter.runner;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.ryuqq.reconciler.core.classifier.StatusCodeRetryClassifier;
import com.ryuqq.reconciler.core.diagnostic.Phase;
import com.ryuqq.reconciler.core.model.DesiredState;
import com.ryuqq.reconciler.core.model.ResourceDelta;
import com.ryuqq.reconciler.core.model.ResourceDescriptor;
import com.ryuqq.reconciler.core.model.ResourceId;
import com.ryuqq.reconciler.core.poll.PollConfig;
import com.ryuqq.reconciler.core.spi.ResourceClient;
import com.ryuqq.reconciler.core.spi.StateResolver;
import com.ryuqq.reconciler.core.time.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StatusPoller 로그 레벨 테스트.
 *
 * <p>정상 수렴은 WARN 없이, 제한 시간 초과와 치명적 오류는 WARN으로 기록되는지 검증합니다.</p>
 *
 * @author Reconciler Team
 * @since 1.0.0
 */
class StatusPollerLoggingTest {

    private static final ResourceId ZONE_ID = ResourceId.of("z1");

    private final Logger logger = (Logger) LoggerFactory.getLogger(StatusPoller.class);
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private StatusPoller pollerReturning(String... statuses) {
        ResourceDescriptor[] descriptors = new ResourceDescriptor[statuses.length];
        for (int i = 0; i < statuses.length; i++) {
            descriptors[i] = ResourceDescriptor.builder(ZONE_ID).status(statuses[i]).build();
        }
        int[] reads = {0};
        ResourceClient client = new ResourceClient() {
            @Override
            public ResourceDescriptor create(DesiredState desired) {
                throw new UnsupportedOperationException("create");
            }

            @Override
            public ResourceDescriptor read(ResourceId id) {
                int index = Math.min(reads[0]++, descriptors.length - 1);
                return descriptors[index];
            }

            @Override
            public ResourceDescriptor update(ResourceId id, ResourceDelta delta) {
                throw new UnsupportedOperationException("update");
            }

            @Override
            public void delete(ResourceId id) {
                throw new UnsupportedOperationException("delete");
            }
        };
        return new StatusPoller(client, StateResolver.byName(), new StatusCodeRetryClassifier(),
            new FakeTimeSource(), 10_000, 0.0);
    }

    @Test
    void 정상_수렴은_WARN_없음() {
        // given
        StatusPoller poller = pollerReturning("PENDING", "ACTIVE");

        // when
        poller.await(ZONE_ID, Phase.CREATE, PollConfig.untilActive(60_000, 0, 10), CancellationToken.none());

        // then
        assertThat(appender.list).noneMatch(e -> e.getLevel() == Level.WARN);
    }

    @Test
    void 제한시간_초과는_WARN_기록() {
        // given
        StatusPoller poller = pollerReturning("PENDING");

        // when
        poller.await(ZONE_ID, Phase.CREATE, PollConfig.untilActive(100, 0, 30), CancellationToken.none());

        // then
        assertThat(appender.list)
            .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("timed out"));
    }

    @Test
    void 예상하지_못한_상태는_WARN_기록() {
        // given
        StatusPoller poller = pollerReturning("ERROR");

        // when
        poller.await(ZONE_ID, Phase.UPDATE, PollConfig.untilActive(60_000, 0, 10), CancellationToken.none());

        // then
        assertThat(appender.list)
            .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("unexpected state"));
    }
}
