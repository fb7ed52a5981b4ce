package com.example.guardianservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GuardianServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardianServiceApplication.class, args);
    }
}
