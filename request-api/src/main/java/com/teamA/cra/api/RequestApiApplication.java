package com.teamA.cra.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.teamA.cra")
public class RequestApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(RequestApiApplication.class, args);
    }
}
