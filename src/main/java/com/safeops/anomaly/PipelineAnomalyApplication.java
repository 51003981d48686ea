package com.safeops.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PipelineAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineAnomalyApplication.class, args);
    }
}
