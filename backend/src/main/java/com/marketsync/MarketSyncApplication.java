package com.marketsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketSyncApplication.class, args);
    }
}
