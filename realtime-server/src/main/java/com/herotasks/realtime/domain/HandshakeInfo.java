package com.herotasks.realtime.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Transport-neutral view of an upgrade request: query parameters and headers.
 * Header names are matched case-insensitively.
 */
@Value
@Builder
public class HandshakeInfo {

    private static final String BEARER_PREFIX = "Bearer ";

    @Singular
    Map<String, String> queryParams;

    @Singular
    Map<String, List<String>> headers;

    public String token() {
        String fromQuery = queryParams.get("token");
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String authorization = header("Authorization");
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    public String claimedUserId() {
        String userId = queryParams.get("userId");
        if (userId == null || userId.isBlank()) {
            userId = queryParams.get("user_id");
        }
        return userId == null || userId.isBlank() ? null : userId;
    }

    private String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
