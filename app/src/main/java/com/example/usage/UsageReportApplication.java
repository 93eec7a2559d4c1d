package com.example.usage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UsageReportApplication {
    public static void main(String[] args) {
        SpringApplication.run(UsageReportApplication.class, args);
    }
}
