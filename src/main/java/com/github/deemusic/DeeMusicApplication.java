package com.github.deemusic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeeMusicApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeeMusicApplication.class, args);
    }
}
