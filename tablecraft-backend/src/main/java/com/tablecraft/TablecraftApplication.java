package com.tablecraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TablecraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(TablecraftApplication.class, args);
    }
}
