package com.fieldops.dismantle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DismantleChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(DismantleChatApplication.class, args);
    }
}
