package io.github.drompincen.pocpilot.gateway;

import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.pocpilot")
@EnableMongoRepositories(basePackages = "io.github.drompincen.pocpilot.persistence.repository")
@EnableConfigurationProperties(AssistantProperties.class)
@EnableScheduling
public class PocPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocPilotApplication.class, args);
    }
}
