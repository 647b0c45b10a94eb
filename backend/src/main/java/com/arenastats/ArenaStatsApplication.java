package com.arenastats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ArenaStatsApplication {
    public static void main(String[] args) {
        SpringApplication.run(ArenaStatsApplication.class, args);
    }
}
