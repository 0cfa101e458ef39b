package com.simsuggest.similarity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SimilarityServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SimilarityServiceApplication.class, args);
    }
}
