package com.sparta.redemption;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RedemptionCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedemptionCoreApplication.class, args);
    }
}
