package com.example.transformationhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransformationHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransformationHubApplication.class, args);
    }
}
