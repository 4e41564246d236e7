package com.example.courserag;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class CourseRagApplication {

    public static void main(String[] args) {
        log.info("Starting course assistant application");
        SpringApplication.run(CourseRagApplication.class, args);
        log.info("Course assistant application started");
    }

}
