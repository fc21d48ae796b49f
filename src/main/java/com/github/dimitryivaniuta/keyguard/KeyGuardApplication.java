package com.github.dimitryivaniuta.keyguard;

import com.github.dimitryivaniuta.keyguard.config.KeyGuardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(KeyGuardProperties.class)
public class KeyGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyGuardApplication.class, args);
    }
}
