package com.demo.thrift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThriftApplication {
    public static void main(String[] args) {
        SpringApplication.run(ThriftApplication.class, args);
    }
}
