package com.archintent.resolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntentResolverApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntentResolverApplication.class, args);
    }
}
