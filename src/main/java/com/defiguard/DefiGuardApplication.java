package com.defiguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DefiGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(DefiGuardApplication.class, args);
    }
}
