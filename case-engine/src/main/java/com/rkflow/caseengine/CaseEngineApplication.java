package com.rkflow.caseengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaseEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseEngineApplication.class, args);
    }
}
