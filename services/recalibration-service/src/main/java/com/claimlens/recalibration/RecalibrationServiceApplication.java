package com.claimlens.recalibration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecalibrationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecalibrationServiceApplication.class, args);
    }
}
