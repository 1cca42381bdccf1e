package com.helixvision.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HelixVisionApplication {

    public static void main(String[] args) {
        // rendering only ever targets off-screen images
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(HelixVisionApplication.class, args);
    }
}
