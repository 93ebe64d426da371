package com.feedsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeedSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedSyncApplication.class, args);
    }
}
