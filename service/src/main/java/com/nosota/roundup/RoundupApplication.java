package com.nosota.roundup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RoundupApplication {
    public static void main(String[] args) {
        SpringApplication.run(RoundupApplication.class, args);
    }
}
