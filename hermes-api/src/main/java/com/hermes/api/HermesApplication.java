package com.hermes.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for Hermes.
 * The DataSource is created by the engine only when JDBC storage is selected.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ComponentScan(basePackages = {
    "com.hermes.api",
    "com.hermes.engine"
})
public class HermesApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(HermesApplication.class, args);
    }
}
