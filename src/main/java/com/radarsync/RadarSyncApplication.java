package com.radarsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadarSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RadarSyncApplication.class, args);
    }
}
