package com.example.offlinecache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OfflineCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfflineCacheApplication.class, args);
    }
}
