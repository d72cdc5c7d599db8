package com.wshg.catalog;

import com.wshg.catalog.config.CatalogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CatalogProperties.class)
public class ResourceCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResourceCatalogApplication.class, args);
    }
}
