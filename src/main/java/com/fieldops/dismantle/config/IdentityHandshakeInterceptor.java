package com.fieldops.dismantle.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Takes the caller identity from the last path segment ({@code /ws/chat/{username}}).
 * The identity is trusted as supplied by the upstream layer.
 */
@Slf4j
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "chat.identity";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String identity = identityFromPath(request.getURI().getRawPath());
        if (identity == null) {
            log.warn("Handshake rejected, no identity in {}", request.getURI());
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        attributes.put(IDENTITY_ATTRIBUTE, identity);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        // nothing to do
    }

    /** Percent-decodes the last segment of a raw path; {@code +} is kept as is. */
    static String identityFromPath(String rawPath) {
        if (rawPath == null) return null;
        String segment;
        try {
            segment = UriUtils.decode(rawPath.substring(rawPath.lastIndexOf('/') + 1), StandardCharsets.UTF_8).trim();
        } catch (IllegalArgumentException malformed) {
            log.debug("Undecodable identity segment in {}", rawPath);
            return null;
        }
        return segment.isEmpty() ? null : segment;
    }
}
