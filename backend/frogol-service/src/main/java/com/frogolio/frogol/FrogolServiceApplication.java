package com.frogolio.frogol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FrogolServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FrogolServiceApplication.class, args);
    }
}
