package com.agonyforge.perpscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PerpScanner {
    public static void main(String... args) {
        SpringApplication.run(PerpScanner.class, args);
    }
}
