package com.goormthonuniv.newscheckr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NewsCheckrApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsCheckrApplication.class, args);
    }
}
