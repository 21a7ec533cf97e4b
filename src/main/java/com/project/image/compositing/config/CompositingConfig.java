package com.project.image.compositing.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CompositingProperties.class)
public class CompositingConfig {
}
