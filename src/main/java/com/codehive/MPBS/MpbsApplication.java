package com.codehive.MPBS;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MpbsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MpbsApplication.class, args);
    }
}
