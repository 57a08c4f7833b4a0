package com.jay.carbonscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CarbonScoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(CarbonScoreApplication.class, args);
    }
}
