package com.deepansh.foundry;

import com.deepansh.foundry.config.FoundryProperties;
import com.deepansh.foundry.config.McpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({FoundryProperties.class, McpProperties.class})
public class FoundryMcpAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(FoundryMcpAgentApplication.class, args);
    }
}
