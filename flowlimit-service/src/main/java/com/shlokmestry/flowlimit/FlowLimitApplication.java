package com.shlokmestry.flowlimit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowLimitApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowLimitApplication.class, args);
    }
}
