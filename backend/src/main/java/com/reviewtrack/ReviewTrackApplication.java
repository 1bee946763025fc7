package com.reviewtrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReviewTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewTrackApplication.class, args);
    }
}
