package com.demo.chathub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatHubApplication.class, args);
    }
}
