package com.ranquality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RanQualityApplication {

    public static void main(String[] args) {
        SpringApplication.run(RanQualityApplication.class, args);
    }
}
