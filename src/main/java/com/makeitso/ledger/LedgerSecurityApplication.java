package com.makeitso.ledger;

import com.makeitso.ledger.config.SecurityPolicyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// Scheduling drives the session sweep, activity flush and alert redelivery.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(SecurityPolicyProperties.class)
public class LedgerSecurityApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerSecurityApplication.class, args);
    }
}
