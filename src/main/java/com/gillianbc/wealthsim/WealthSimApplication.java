package com.gillianbc.wealthsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WealthSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(WealthSimApplication.class, args);
    }
}
