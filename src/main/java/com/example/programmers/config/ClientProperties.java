package com.example.programmers.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the single page that boots the Angular client.
 */
@Data
@ConfigurationProperties(prefix = "programmers.client")
public class ClientProperties {
    private String title = "Programmers";

    // Loaded in order: Angular core first, the application script last
    private List<String> scripts = new ArrayList<>();
}
