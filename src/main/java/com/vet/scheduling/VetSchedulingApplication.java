package com.vet.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VetSchedulingApplication {

    public static void main(String[] args) {
        SpringApplication.run(VetSchedulingApplication.class, args);
    }
}
