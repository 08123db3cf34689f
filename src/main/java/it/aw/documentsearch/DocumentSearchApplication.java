package it.aw.documentsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocumentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentSearchApplication.class, args);
    }
}
