package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.profiles")
public class ProfileSourceProperties {

    /**
     * JSON file holding an array of normalized profiles.
     */
    private String file = "profiles.json";
}
