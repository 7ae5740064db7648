package com.myorg.tocparser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TocParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(TocParserApplication.class, args);
    }
}
