package com.trustplatform.reputation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReputationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReputationServiceApplication.class, args);
    }
}
