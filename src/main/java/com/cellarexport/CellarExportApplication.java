package com.cellarexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CellarExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(CellarExportApplication.class, args);
    }
}
