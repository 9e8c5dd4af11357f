package com.chicu.papertradebot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication(scanBasePackages = "com.chicu.papertradebot")
public class PaperTradeBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperTradeBotApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
