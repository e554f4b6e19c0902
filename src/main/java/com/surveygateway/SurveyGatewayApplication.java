package com.surveygateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyGatewayApplication.class, args);
    }
}
