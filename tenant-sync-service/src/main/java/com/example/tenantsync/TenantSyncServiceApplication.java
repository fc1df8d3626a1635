package com.example.tenantsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TenantSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenantSyncServiceApplication.class, args);
    }
}
