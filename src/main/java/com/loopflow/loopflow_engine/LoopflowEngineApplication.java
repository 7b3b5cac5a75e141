package com.loopflow.loopflow_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LoopflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoopflowEngineApplication.class, args);
    }
}
