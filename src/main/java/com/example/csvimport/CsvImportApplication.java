package com.example.csvimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CsvImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(CsvImportApplication.class, args);
    }
}
