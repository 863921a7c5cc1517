package com.deepansh.foundry.config;

import com.deepansh.foundry.tool.ToolCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ToolConfig {

    @Bean
    public ToolCatalog toolCatalog(McpProperties props) {
        return ToolCatalog.fromProperties(props);
    }

    /** UTC clock; the search-query recency filter is computed from it */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
