package com.tracker.hierarchy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Work item hierarchy extraction service - Spring Boot entry point
 *
 * @version 1.0.0
 */
@SpringBootApplication
public class HierarchyApplication {

    public static void main(String[] args) {
        SpringApplication.run(HierarchyApplication.class, args);
    }
}
