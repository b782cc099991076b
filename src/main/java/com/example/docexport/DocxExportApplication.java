package com.example.docexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocxExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxExportApplication.class, args);
    }

}
