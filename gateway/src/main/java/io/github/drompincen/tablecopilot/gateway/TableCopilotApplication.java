package io.github.drompincen.tablecopilot.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.tablecopilot")
@EnableScheduling
public class TableCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(TableCopilotApplication.class, args);
    }
}
