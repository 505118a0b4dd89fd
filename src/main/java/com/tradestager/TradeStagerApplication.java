package com.tradestager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeStagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeStagerApplication.class, args);
    }
}
