package com.example.pictochat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PictochatApplication {

    public static void main(String[] args) {
        SpringApplication.run(PictochatApplication.class, args);
    }
}
