package com.factql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactqlApplication.class, args);
    }
}
