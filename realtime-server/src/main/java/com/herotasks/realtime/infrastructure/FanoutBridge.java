package com.herotasks.realtime.infrastructure;

import com.herotasks.realtime.config.RealtimeProperties;
import com.herotasks.realtime.domain.BusChannel;
import com.herotasks.realtime.domain.BusMessage;
import com.herotasks.realtime.domain.BusState;
import com.herotasks.realtime.service.MetricsService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Makes local broadcasts visible to every instance through Redis Pub/Sub.
 *
 * Outbound: {@link #publish} stamps the message with this instance's id and
 * sends it on the mapped Redis channel. Inbound: messages from other
 * instances are replayed through {@link LocalBroadcaster} only, so nothing
 * received from the bus is ever published again. Messages carrying this
 * instance's own id are dropped, since Redis echoes them back to us.
 *
 * Connecting never blocks the caller. Failures are retried according to
 * the {@link ReconnectPolicy}; once it gives up the bridge stays
 * {@link BusState#DEGRADED} and the server keeps running on local delivery
 * until it is restarted.
 */
@Component
@Slf4j
public class FanoutBridge implements MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final LocalBroadcaster localBroadcaster;
    private final EnvelopeCodec codec;
    private final MetricsService metricsService;
    private final ScheduledExecutorService scheduler;
    private final ReconnectPolicy reconnectPolicy;
    private final RealtimeProperties.Bus busProperties;
    private final String instanceId;

    private final AtomicReference<BusState> state = new AtomicReference<>(BusState.CONNECTING);
    private final AtomicInteger failedAttempts = new AtomicInteger(0);
    private volatile boolean subscribed;
    private volatile boolean stopped;

    public FanoutBridge(StringRedisTemplate redisTemplate,
                        RedisMessageListenerContainer listenerContainer,
                        LocalBroadcaster localBroadcaster,
                        EnvelopeCodec codec,
                        MetricsService metricsService,
                        @Qualifier("busReconnectScheduler") ScheduledExecutorService scheduler,
                        RealtimeProperties properties) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.localBroadcaster = localBroadcaster;
        this.codec = codec;
        this.metricsService = metricsService;
        this.scheduler = scheduler;
        this.busProperties = properties.getBus();
        this.instanceId = properties.getInstanceId();
        this.reconnectPolicy = new ReconnectPolicy(
                busProperties.getReconnect().getStep(),
                busProperties.getReconnect().getMaxDelay(),
                busProperties.getReconnect().getMaxAttempts());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!busProperties.isEnabled()) {
            state.set(BusState.DEGRADED);
            log.warn("Bus disabled by configuration, running with local delivery only");
            return;
        }
        log.info("Connecting to bus: instanceId={}, channels=[{}, {}]",
                instanceId, busProperties.getTaskChannel(), busProperties.getPresenceChannel());
        scheduler.execute(this::attemptConnect);
    }

    /**
     * Publishes to the bus when connected; otherwise the message is skipped
     * and only local delivery happens.
     *
     * @return true if the message was handed to Redis
     */
    public boolean publish(BusChannel channel, BusMessage message) {
        BusState current = state.get();
        if (current != BusState.CONNECTED) {
            log.debug("Bus not connected, skipping publish: channel={}, state={}", channel, current);
            return false;
        }

        String channelName = channelName(channel);
        try {
            message.setOrigin(instanceId);
            String payload = codec.encodeBus(message);
            Long receivers = redisTemplate.convertAndSend(channelName, payload);

            metricsService.recordBusPublish(channelName, true);
            log.debug("Published to bus: channel={}, type={}, receivers={}",
                    channelName, message.getEnvelope().getType(), receivers);
            return true;

        } catch (Exception e) {
            metricsService.recordBusPublish(channelName, false);
            log.warn("Failed to publish to bus: channel={}, error={}", channelName, e.getMessage());
            onPublishFailure();
            return false;
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        String body = new String(message.getBody(), StandardCharsets.UTF_8);

        try {
            BusMessage busMessage = codec.decodeBus(body);
            if (instanceId.equals(busMessage.getOrigin())) {
                return;
            }

            metricsService.recordBusReceived(channel);
            int delivered = localBroadcaster.replay(busMessage);

            log.debug("Replayed bus message: channel={}, origin={}, type={}, delivered={}",
                    channel, busMessage.getOrigin(), busMessage.getEnvelope().getType(), delivered);

        } catch (InvalidEnvelopeException e) {
            metricsService.recordError("MALFORMED_BUS_MESSAGE", "FanoutBridge");
            log.warn("Dropping malformed bus message: channel={}, error={}", channel, e.getMessage());
        } catch (Exception e) {
            log.error("Error replaying bus message: channel={}", channel, e);
        }
    }

    public BusState getState() {
        return state.get();
    }

    public boolean isDegraded() {
        return state.get() == BusState.DEGRADED;
    }

    public String getInstanceId() {
        return instanceId;
    }

    @PreDestroy
    public void shutdown() {
        stopped = true;
        unsubscribe();
        log.info("FanoutBridge stopped: instanceId={}", instanceId);
    }

    void attemptConnect() {
        if (stopped || state.get() == BusState.DEGRADED) {
            return;
        }
        try {
            ping();
            subscribe();
            failedAttempts.set(0);
            state.set(BusState.CONNECTED);
            log.info("Bus connected: instanceId={}", instanceId);

        } catch (Exception e) {
            int attempt = failedAttempts.incrementAndGet();
            Optional<Duration> delay = reconnectPolicy.delayFor(attempt);
            if (delay.isPresent()) {
                log.warn("Bus connection failed: attempt={}, retryInMs={}, error={}",
                        attempt, delay.get().toMillis(), e.getMessage());
                scheduler.schedule(this::attemptConnect, delay.get().toMillis(), TimeUnit.MILLISECONDS);
            } else {
                enterDegradedMode(attempt, e);
            }
        }
    }

    private void onPublishFailure() {
        if (state.compareAndSet(BusState.CONNECTED, BusState.CONNECTING)) {
            failedAttempts.set(0);
            log.warn("Bus connection lost, reconnecting");
            scheduler.execute(this::attemptConnect);
        }
    }

    private void enterDegradedMode(int attempts, Exception lastError) {
        state.set(BusState.DEGRADED);
        metricsService.recordError("BUS_UNAVAILABLE", "FanoutBridge");
        log.error("Bus unreachable after {} attempts, continuing with local delivery only: {}",
                attempts, lastError.getMessage());
        unsubscribe();
    }

    private void ping() {
        RedisConnectionFactory factory = Objects.requireNonNull(
                redisTemplate.getConnectionFactory(), "Redis connection factory not configured");
        try (RedisConnection connection = factory.getConnection()) {
            connection.ping();
        }
    }

    private void subscribe() {
        if (!subscribed) {
            listenerContainer.addMessageListener(this, List.of(
                    new ChannelTopic(busProperties.getTaskChannel()),
                    new ChannelTopic(busProperties.getPresenceChannel())));
            subscribed = true;
        }
        if (!listenerContainer.isRunning()) {
            listenerContainer.start();
        }
    }

    private void unsubscribe() {
        if (!subscribed) {
            return;
        }
        try {
            listenerContainer.removeMessageListener(this);
            subscribed = false;
        } catch (Exception e) {
            log.warn("Failed to remove bus listener: {}", e.getMessage());
        }
    }

    private String channelName(BusChannel channel) {
        return channel == BusChannel.TASK_UPDATES
                ? busProperties.getTaskChannel()
                : busProperties.getPresenceChannel();
    }
}
