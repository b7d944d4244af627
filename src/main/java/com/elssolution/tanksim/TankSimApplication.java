package com.elssolution.tanksim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TankSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(TankSimApplication.class, args);
    }

}
