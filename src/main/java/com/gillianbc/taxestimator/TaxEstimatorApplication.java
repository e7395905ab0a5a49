package com.gillianbc.taxestimator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxEstimatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxEstimatorApplication.class, args);
    }
}
