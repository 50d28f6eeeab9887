package com.herotasks.realtime.handler;

import com.herotasks.realtime.domain.HandshakeInfo;
import com.herotasks.realtime.support.RealtimeFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class TokenHandshakeInterceptorTest {

    private final RealtimeFixture fixture = new RealtimeFixture();

    private TokenHandshakeInterceptor interceptor;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        interceptor = new TokenHandshakeInterceptor(fixture.lifecycle(
                mock(ScheduledExecutorService.class), mock(ExecutorService.class)));
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    private boolean handshake(MockHttpServletRequest servletRequest) {
        return interceptor.beforeHandshake(
                new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse),
                mock(WebSocketHandler.class),
                attributes);
    }

    private MockHttpServletRequest upgrade(String queryString) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/tasks");
        request.setQueryString(queryString);
        return request;
    }

    @Test
    void validQueryTokenStoresUserId() {
        String token = fixture.securityValidator.generateToken("alice");

        assertThat(handshake(upgrade("token=" + token + "&userId=alice"))).isTrue();
        assertThat(attributes).containsEntry(TokenHandshakeInterceptor.USER_ID_ATTRIBUTE, "alice");
    }

    @Test
    void validBearerHeaderStoresUserId() {
        MockHttpServletRequest request = upgrade(null);
        request.addHeader("Authorization", "Bearer " + fixture.securityValidator.generateToken("bob"));

        assertThat(handshake(request)).isTrue();
        assertThat(attributes).containsEntry(TokenHandshakeInterceptor.USER_ID_ATTRIBUTE, "bob");
    }

    @Test
    void missingTokenIsUnauthorized() {
        assertThat(handshake(upgrade("userId=alice"))).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
        assertThat(fixture.registry.size()).isZero();
    }

    @Test
    void mismatchedUserIsUnauthorized() {
        String token = fixture.securityValidator.generateToken("alice");

        assertThat(handshake(upgrade("token=" + token + "&user_id=mallory"))).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
    }

    @Test
    void decodesQueryParameters() {
        HandshakeInfo info = TokenHandshakeInterceptor.toHandshakeInfo(
                new ServletServerHttpRequest(upgrade("token=a%2Bb&userId=j%C3%BCrgen")));

        assertThat(info.token()).isEqualTo("a+b");
        assertThat(info.claimedUserId()).isEqualTo("jürgen");
    }
}
