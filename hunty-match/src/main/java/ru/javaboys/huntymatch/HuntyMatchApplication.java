package ru.javaboys.huntymatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class HuntyMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HuntyMatchApplication.class, args);
    }
}
