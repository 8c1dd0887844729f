package com.seamcarving.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeamCarvingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeamCarvingApplication.class, args);
    }
}
