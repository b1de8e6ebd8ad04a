package com.pnode.pnode_analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PNodeAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PNodeAnalyticsApplication.class, args);
    }
}
