package dev.aparikh.msgexplorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MessageExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MessageExplorerApplication.class, args);
    }
}
