package com.signaltrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class SignaltraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignaltraderApplication.class, args);
    }
}
