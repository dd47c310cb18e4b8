package com.example.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HiringPipelineMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiringPipelineMcpApplication.class, args);
    }
}
