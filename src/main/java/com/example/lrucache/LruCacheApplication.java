package com.example.lrucache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LruCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(LruCacheApplication.class, args);
    }
}
