package com.example.filegate;

import com.example.filegate.config.properties.FileGateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FileGateProperties.class)
public class FileGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileGateApplication.class, args);
    }

}
