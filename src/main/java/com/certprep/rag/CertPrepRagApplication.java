package com.certprep.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CertPrepRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CertPrepRagApplication.class, args);
    }
}
