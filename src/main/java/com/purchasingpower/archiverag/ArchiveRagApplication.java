package com.purchasingpower.archiverag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ArchiveRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchiveRagApplication.class, args);
    }
}
