package com.medimind.reference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication(scanBasePackages = {"com.medimind"})
public class MedimindApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedimindApplication.class, args);
    }
}
