package com.scholary.talkingpet.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for pipeline-wide settings.
 *
 * <p>Enables the GenerationProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {}
