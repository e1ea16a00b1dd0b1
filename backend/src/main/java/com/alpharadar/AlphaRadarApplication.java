package com.alpharadar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlphaRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlphaRadarApplication.class, args);
    }
}
