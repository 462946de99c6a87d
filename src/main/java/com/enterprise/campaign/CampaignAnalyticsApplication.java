package com.enterprise.campaign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampaignAnalyticsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CampaignAnalyticsApplication.class, args)));
    }
}
