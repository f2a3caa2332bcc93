package com.flowpilot.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FlowPilotSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowPilotSchedulerApplication.class, args);
    }
}
