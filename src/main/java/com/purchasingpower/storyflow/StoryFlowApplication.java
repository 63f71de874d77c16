package com.purchasingpower.storyflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class StoryFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(StoryFlowApplication.class, args);
    }
}
