package com.architecture.memory.graphdiff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GraphDiffApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphDiffApplication.class, args);
    }
}
