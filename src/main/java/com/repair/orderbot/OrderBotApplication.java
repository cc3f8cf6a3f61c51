package com.repair.orderbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OrderBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderBotApplication.class, args);
    }

}
