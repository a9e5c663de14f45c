package com.example.drawingdiff;

import com.example.drawingdiff.config.DrawingDiffProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DrawingDiffProperties.class)
public class DrawingDiffApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrawingDiffApplication.class, args);
    }
}
