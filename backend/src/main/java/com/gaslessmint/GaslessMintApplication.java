package com.gaslessmint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GaslessMintApplication {

    public static void main(String[] args) {
        SpringApplication.run(GaslessMintApplication.class, args);
    }
}
