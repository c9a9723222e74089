package com.example.CommonSupplier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommonSupplierApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommonSupplierApplication.class, args);
    }
}
