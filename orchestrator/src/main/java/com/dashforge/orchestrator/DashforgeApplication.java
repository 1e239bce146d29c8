package com.dashforge.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DashforgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashforgeApplication.class, args);
    }
}
