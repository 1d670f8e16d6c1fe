package com.zzf.simon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SimonApplication {
    private static final Logger logger = LoggerFactory.getLogger(SimonApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SimonApplication.class, args);
        logger.info("simon.started java={}", System.getProperty("java.version"));
    }
}
