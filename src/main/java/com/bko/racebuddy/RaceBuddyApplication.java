package com.bko.racebuddy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RaceBuddyApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaceBuddyApplication.class, args);
    }
}
