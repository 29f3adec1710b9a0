package com.remotelink.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RemoteLink client entry point.
 */
@SpringBootApplication
@EnableScheduling
@ComponentScan(basePackages = "com.remotelink")
public class RemoteLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemoteLinkApplication.class, args);
    }
}
