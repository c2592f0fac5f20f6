package com.ragdocs.gateway.service.curation;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CurationProperties.class)
public class CurationConfig {
}
