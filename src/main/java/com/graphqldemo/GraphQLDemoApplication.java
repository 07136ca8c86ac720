package com.graphqldemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GraphQLDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphQLDemoApplication.class, args);
    }
}
