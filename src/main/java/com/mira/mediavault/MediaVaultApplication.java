package com.mira.mediavault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class MediaVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaVaultApplication.class, args);
    }
}
