package com.wpanther.kmscert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KmsCertApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(KmsCertApplication.class, args)));
    }
}
