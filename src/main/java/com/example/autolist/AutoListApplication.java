package com.example.autolist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoListApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoListApplication.class, args);
    }
}
