package com.pop.txodump;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.pop.txodump")
public class TxoDumpApplication {
    public static void main(String[] args) {
        SpringApplication.run(TxoDumpApplication.class, args);
    }
}
