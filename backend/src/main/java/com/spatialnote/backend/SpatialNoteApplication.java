package com.spatialnote.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpatialNoteApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpatialNoteApplication.class, args);
    }
}
