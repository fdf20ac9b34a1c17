package com.homelab.backupmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class BackupMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackupMonitorApplication.class, args);
    }
}
