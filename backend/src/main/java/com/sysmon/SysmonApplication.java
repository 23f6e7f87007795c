package com.sysmon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SysmonApplication {

    public static void main(String[] args) {
        SpringApplication.run(SysmonApplication.class, args);
    }
}
