package com.flagship.currency_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CurrencyGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CurrencyGatewayApplication.class, args);
    }
}
