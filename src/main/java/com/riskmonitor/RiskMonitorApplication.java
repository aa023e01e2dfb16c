package com.riskmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RiskMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskMonitorApplication.class, args);
    }
}
