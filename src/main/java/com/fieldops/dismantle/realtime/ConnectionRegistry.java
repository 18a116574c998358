package com.fieldops.dismantle.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dismantle.config.ChatProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map «identity → live channel». One channel per identity, the
 * latest connect wins. Delivery is best-effort: a failed send drops the entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Map<String, WebSocketSession> channels = new ConcurrentHashMap<>();

    private final ObjectMapper   objectMapper;
    private final ChatProperties properties;

    /** Registers {@code channel} for {@code identity}, silently replacing a previous one. */
    public void connect(String identity, WebSocketSession channel) {
        ChatProperties.WebSocket ws = properties.getWebsocket();
        WebSocketSession guarded = new ConcurrentWebSocketSessionDecorator(
                channel, ws.getSendTimeLimitMs(), ws.getBufferSizeLimit());

        WebSocketSession previous = channels.put(identity, guarded);
        if (previous != null && !previous.getId().equals(channel.getId())) {
            log.info("ONLINE  ⇢ {}@{} (replaces {})", identity, channel.getId(), previous.getId());
        } else {
            log.info("ONLINE  ⇢ {}@{}", identity, channel.getId());
        }
    }

    /** Removes whatever channel is registered for {@code identity}. Idempotent. */
    public void disconnect(String identity) {
        WebSocketSession removed = channels.remove(identity);
        if (removed != null) {
            log.info("OFFLINE ⇢ {}@{}", identity, removed.getId());
        }
    }

    /**
     * Removes the entry only while it still points at {@code channel}, so a
     * replaced channel closing late does not evict its successor.
     */
    public void disconnect(String identity, WebSocketSession channel) {
        channels.computeIfPresent(identity, (id, current) -> {
            if (!current.getId().equals(channel.getId())) {
                return current;
            }
            log.info("OFFLINE ⇢ {}@{}", identity, channel.getId());
            return null;
        });
    }

    /**
     * Sends {@code payload} as a JSON text frame.
     *
     * @return {@code true} if the frame was handed to a live channel
     */
    public boolean send(String identity, Object payload) {
        WebSocketSession channel = channels.get(identity);
        if (channel == null) {
            log.debug("{} is offline, frame skipped", identity);
            return false;
        }
        String json = serialize(identity, payload);
        if (json == null) {
            return false;
        }

        try {
            channel.sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("Delivery to {}@{} failed, dropping connection: {}", identity, channel.getId(), ex.toString());
            disconnect(identity, channel);
            closeQuietly(channel, CloseStatus.SESSION_NOT_RELIABLE);
            return false;
        }
    }

    /**
     * Answers on the connection a frame came from, even if that connection has
     * since been replaced for {@code identity}. Best-effort: a failed write is
     * only logged.
     */
    public boolean reply(String identity, WebSocketSession origin, Object payload) {
        WebSocketSession current = channels.get(identity);
        WebSocketSession target = current != null && current.getId().equals(origin.getId()) ? current : origin;
        String json = serialize(identity, payload);
        if (json == null) {
            return false;
        }

        try {
            target.sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("Reply to {}@{} failed: {}", identity, origin.getId(), ex.toString());
            return false;
        }
    }

    private String serialize(String identity, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            log.error("Cannot serialize {} for {}", payload.getClass().getSimpleName(), identity, ex);
            return null;
        }
    }

    public boolean isConnected(String identity) {
        return channels.containsKey(identity);
    }

    public int size() {
        return channels.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} chat connections", channels.size());
        new ArrayList<>(channels.entrySet()).forEach(e -> {
            channels.remove(e.getKey(), e.getValue());
            closeQuietly(e.getValue(), CloseStatus.GOING_AWAY);
        });
    }

    private void closeQuietly(WebSocketSession channel, CloseStatus status) {
        try {
            if (channel.isOpen()) {
                channel.close(status);
            }
        } catch (IOException ex) {
            log.debug("Close of {} failed: {}", channel.getId(), ex.toString());
        }
    }
}
