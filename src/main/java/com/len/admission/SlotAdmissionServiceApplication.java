package com.len.admission;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SlotAdmissionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlotAdmissionServiceApplication.class, args);
    }

}
