package com.callrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CallRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallRelayApplication.class, args);
    }
}
