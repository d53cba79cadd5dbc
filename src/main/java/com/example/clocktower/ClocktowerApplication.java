package com.example.clocktower;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class ClocktowerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClocktowerApplication.class, args);
    }
}
