package com.linlay.analysisagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalysisAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisAgentApplication.class, args);
    }
}
