package dev.jobmatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobMatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobMatcherApplication.class, args);
    }
}
