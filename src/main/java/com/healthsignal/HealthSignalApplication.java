package com.healthsignal;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan("com.healthsignal.mapper")
public class HealthSignalApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthSignalApplication.class, args);
    }
}
