package com.quakesignal.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QuakeSignalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuakeSignalEngineApplication.class, args);
    }
}
