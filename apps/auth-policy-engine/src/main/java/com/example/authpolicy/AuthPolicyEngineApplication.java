package com.example.authpolicy;

import com.example.authpolicy.config.properties.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class AuthPolicyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthPolicyEngineApplication.class, args);
    }

}
