package com.contextkit.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.contextkit")
public class ContextKitApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextKitApiApplication.class, args);
    }
}
