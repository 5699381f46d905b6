package com.glowup.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GlowUpApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlowUpApplication.class, args);
    }
}
