package com.statlens.tables;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class StatLensTablesApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatLensTablesApplication.class, args);
    }
}
