package com.factory.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactoryAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactoryAuthApplication.class, args);
    }
}
