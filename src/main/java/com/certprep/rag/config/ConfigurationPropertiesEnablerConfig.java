package com.certprep.rag.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes that are not themselves
 * {@code @Configuration} beans.
 *
 * <ul>
 *   <li>{@link JudgeConfig} - judge temperature, output budget and retry</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(JudgeConfig.class)
public class ConfigurationPropertiesEnablerConfig {
}
