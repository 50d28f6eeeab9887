package com.herotasks.realtime.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Validated
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    @NotBlank
    private String endpoint = "/ws/tasks";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /** Identifies this process on the bus; a random id unless pinned. */
    @NotBlank
    private String instanceId = UUID.randomUUID().toString();

    /** Shared secret for the internal broadcast endpoint. */
    private String internalToken;

    private final Heartbeat heartbeat = new Heartbeat();
    private final Inbox inbox = new Inbox();
    private final Send send = new Send();
    private final Bus bus = new Bus();

    @Data
    public static class Heartbeat {
        @NotNull
        private Duration interval = Duration.ofSeconds(30);
    }

    @Data
    public static class Inbox {
        @Positive
        private int capacity = 256;
        @NotNull
        private Duration offerTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class Send {
        @Positive
        private int timeLimitMs = 10_000;
        @Positive
        private int bufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class Bus {
        private boolean enabled = true;
        @NotBlank
        private String taskChannel = "hero-tasks:task-updates";
        @NotBlank
        private String presenceChannel = "hero-tasks:presence";
        private final Reconnect reconnect = new Reconnect();
    }

    @Data
    public static class Reconnect {
        @NotNull
        private Duration step = Duration.ofMillis(100);
        @NotNull
        private Duration maxDelay = Duration.ofMillis(3000);
        @Positive
        private int maxAttempts = 10;
    }
}
