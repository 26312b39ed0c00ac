package com.legaldedup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class LegalDedupApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalDedupApplication.class, args);
    }
}
