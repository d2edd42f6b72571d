package com.example.redislens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Application Main Class
 */
@SpringBootApplication
public class RedisLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedisLensApplication.class, args);
    }
}
