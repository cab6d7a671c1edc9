package com.seedling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SeedlingApplication {
    public static void main(String[] args) {
        SpringApplication.run(SeedlingApplication.class, args);
    }
}
