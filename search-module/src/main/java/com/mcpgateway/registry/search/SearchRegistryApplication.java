package com.mcpgateway.registry.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.mcpgateway.registry")
@EnableScheduling
public class SearchRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchRegistryApplication.class, args);
    }
}
