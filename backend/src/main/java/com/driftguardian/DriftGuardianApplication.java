package com.driftguardian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriftGuardianApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftGuardianApplication.class, args);
    }
}
