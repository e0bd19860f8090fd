package com.example.feed_engine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables feed engine configuration properties.
 */
@Configuration
@EnableConfigurationProperties(FeedProperties.class)
public class AppPropertiesConfig {
}
