package com.fieldops.dismantle.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ChatProperties.class)
public class ChatConfig {

    /** Source of message and room timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
