package com.optiontracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionTrackerApplication.class, args);
    }
}
