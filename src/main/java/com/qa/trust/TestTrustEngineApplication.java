package com.qa.trust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TestTrustEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestTrustEngineApplication.class, args);
    }
}
