package com.fieldops.dismantle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    private WebSocket websocket = new WebSocket();
    private History   history   = new History();
    private Realtime  realtime  = new Realtime();

    @Data
    public static class WebSocket {
        /** Ant-style path; the identity is the last segment. */
        private String path = "/ws/chat/*";
        private String[] allowedOrigins = {"*"};
        private int sendTimeLimitMs = 10_000;
        private int bufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class History {
        private int defaultLimit = 50;
        private int maxLimit = 200;
    }

    @Data
    public static class Realtime {
        /** Reject actions on rooms the connected identity is not a member of. */
        private boolean enforceMembership = false;
    }
}
