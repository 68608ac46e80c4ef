package com.minipivot.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.minipivot")
@ConfigurationPropertiesScan(basePackages = "com.minipivot")
@EnableScheduling
public class MiniPivotApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiniPivotApplication.class, args);
    }
}
