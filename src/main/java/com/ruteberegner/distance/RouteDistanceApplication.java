package com.ruteberegner.distance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RouteDistanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouteDistanceApplication.class, args);
    }
}
