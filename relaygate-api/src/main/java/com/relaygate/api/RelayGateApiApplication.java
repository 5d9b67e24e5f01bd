package com.relaygate.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.relaygate")
public class RelayGateApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayGateApiApplication.class, args);
    }
}
