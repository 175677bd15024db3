package com.csd.repograder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepoGraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoGraderApplication.class, args);
    }
}
