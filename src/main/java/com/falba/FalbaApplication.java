package com.falba;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FalbaApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FalbaApplication.class, args)));
    }
}
