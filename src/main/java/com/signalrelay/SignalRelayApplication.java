package com.signalrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SignalRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalRelayApplication.class, args);
    }
}
