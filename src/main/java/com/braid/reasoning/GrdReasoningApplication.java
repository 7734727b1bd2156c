package com.braid.reasoning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrdReasoningApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrdReasoningApplication.class, args);
    }
}
