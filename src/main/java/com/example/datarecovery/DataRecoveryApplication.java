package com.example.datarecovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataRecoveryApplication.class, args);
    }
}
