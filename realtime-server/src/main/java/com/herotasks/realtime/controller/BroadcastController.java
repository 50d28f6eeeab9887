package com.herotasks.realtime.controller;

import com.herotasks.realtime.config.RealtimeProperties;
import com.herotasks.realtime.controller.dto.BroadcastRequest;
import com.herotasks.realtime.domain.Envelope;
import com.herotasks.realtime.domain.EnvelopeType;
import com.herotasks.realtime.service.BroadcastService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Internal entry point for application services that push task changes
 * after their own writes. Protected by a shared bearer token.
 */
@Slf4j
@RestController
@RequestMapping("/api/broadcast")
public class BroadcastController {

    private final BroadcastService broadcastService;
    private final String internalToken;

    public BroadcastController(BroadcastService broadcastService, RealtimeProperties properties) {
        this.broadcastService = broadcastService;
        this.internalToken = properties.getInternalToken();
    }

    @PostMapping("/tasks")
    public ResponseEntity<?> broadcastTask(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @Valid @RequestBody BroadcastRequest request) {

        if (!authorized(auth)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        EnvelopeType type = EnvelopeType.fromWire(request.getEventType());
        if (!type.isTaskEvent()) {
            throw new IllegalArgumentException("Unsupported task event type: " + request.getEventType());
        }

        Envelope envelope = broadcastService.broadcastTaskUpdate(
                type, request.getData(), request.getUserId(), request.getTaskId());

        log.info("[BROADCAST] task event accepted: type={}, taskId={}", type.getWireName(), request.getTaskId());
        return accepted(envelope);
    }

    @PostMapping("/presence")
    public ResponseEntity<?> broadcastPresence(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @Valid @RequestBody BroadcastRequest request) {

        if (!authorized(auth)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        EnvelopeType type = EnvelopeType.fromWire(request.getEventType());
        if (!type.isPresenceEvent()) {
            throw new IllegalArgumentException("Unsupported presence event type: " + request.getEventType());
        }

        Envelope envelope = broadcastService.broadcastPresenceUpdate(
                type, request.getData(), request.getUserId(), request.getTaskId());

        log.info("[BROADCAST] presence event accepted: type={}, taskId={}", type.getWireName(), request.getTaskId());
        return accepted(envelope);
    }

    private ResponseEntity<?> accepted(Envelope envelope) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "type", envelope.getType().getWireName(),
                "timestamp", envelope.getTimestamp().toString()
        ));
    }

    private boolean authorized(String auth) {
        if (internalToken == null || internalToken.isBlank()) {
            log.warn("Internal broadcast endpoint called but realtime.internal-token is not configured");
            return false;
        }
        if (auth == null) {
            return false;
        }
        byte[] expected = ("Bearer " + internalToken).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, auth.getBytes(StandardCharsets.UTF_8));
    }
}
