package com.fieldops.dismantle.realtime;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class PresenceController {

    private final ConnectionRegistry registry;

    /** Whether {@code username} currently holds a live chat connection. */
    @GetMapping("/chat/connections/{username}")
    public ResponseEntity<Map<String, Object>> presence(@PathVariable String username) {
        return ResponseEntity.ok(Map.of(
                "username", username,
                "online", registry.isConnected(username)));
    }
}
