package com.fitjourney.backend.journey.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(JourneyProperties.class)
public class JourneyConfig {}
