package com.autonomous.dogwalker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DogwalkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DogwalkerApplication.class, args);
    }
}
