package com.loadforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoadForecastApplication.class, args);
    }
}
