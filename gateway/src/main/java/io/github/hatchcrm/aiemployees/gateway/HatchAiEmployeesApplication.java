package io.github.hatchcrm.aiemployees.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.hatchcrm.aiemployees")
@EnableMongoRepositories(basePackages = "io.github.hatchcrm.aiemployees.persistence.repository")
public class HatchAiEmployeesApplication {

    public static void main(String[] args) {
        SpringApplication.run(HatchAiEmployeesApplication.class, args);
    }
}
