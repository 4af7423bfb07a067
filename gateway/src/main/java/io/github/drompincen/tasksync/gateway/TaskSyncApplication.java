package io.github.drompincen.tasksync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.tasksync")
public class TaskSyncApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TaskSyncApplication.class, args)));
    }
}
