package com.moosivp.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MoosAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MoosAnalyzerApplication.class, args);
    }
}
