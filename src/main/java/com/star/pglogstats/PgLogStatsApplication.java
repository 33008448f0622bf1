package com.star.pglogstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PgLogStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgLogStatsApplication.class, args);
    }
}
