package com.example.slacksearch;

import com.example.slacksearch.gateway.GatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class SlackSearchMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlackSearchMcpApplication.class, args);
    }
}
