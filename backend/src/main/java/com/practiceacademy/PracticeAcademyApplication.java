package com.practiceacademy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PracticeAcademyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PracticeAcademyApplication.class, args);
    }
}
