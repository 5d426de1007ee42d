package com.valuation.riskengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValuationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValuationEngineApplication.class, args);
    }
}
