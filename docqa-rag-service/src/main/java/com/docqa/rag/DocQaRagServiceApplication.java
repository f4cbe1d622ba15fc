package com.docqa.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DocQaRagServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(DocQaRagServiceApplication.class, args);
    }
}
