package net.clusterpool.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClusterPoolApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClusterPoolApplication.class, args);
    }
}
