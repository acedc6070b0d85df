package com.ehrgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EhrGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(EhrGatewayApplication.class, args);
    }
}
