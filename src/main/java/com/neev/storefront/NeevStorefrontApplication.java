package com.neev.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NeevStorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeevStorefrontApplication.class, args);
    }
}
