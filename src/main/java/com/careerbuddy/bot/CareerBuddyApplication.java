package com.careerbuddy.bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CareerBuddyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareerBuddyApplication.class, args);
    }
}
