package com.hrflow.hrflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HrflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(HrflowBackendApplication.class, args);
    }
}
