package com.crescent.gateway;

import com.crescent.gateway.config.GatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(GatewayProperties.class)
public class CrescentGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrescentGatewayApplication.class, args);
    }

}
