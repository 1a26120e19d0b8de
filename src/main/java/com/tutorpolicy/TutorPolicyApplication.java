package com.tutorpolicy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TutorPolicyApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorPolicyApplication.class, args);
    }
}
