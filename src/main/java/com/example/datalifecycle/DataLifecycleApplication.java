package com.example.datalifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DataLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataLifecycleApplication.class, args);
    }
}
