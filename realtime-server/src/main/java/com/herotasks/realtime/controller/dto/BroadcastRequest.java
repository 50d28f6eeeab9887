package com.herotasks.realtime.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastRequest {

    @NotBlank
    private String eventType;

    private Map<String, Object> data;

    /** Originating user; excluded from delivery. */
    @NotBlank
    private String userId;

    private String taskId;
}
