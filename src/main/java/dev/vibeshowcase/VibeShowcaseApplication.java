package dev.vibeshowcase;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VibeShowcaseApplication {

    public static void main(String[] args) {
        SpringApplication.run(VibeShowcaseApplication.class, args);
    }
}
