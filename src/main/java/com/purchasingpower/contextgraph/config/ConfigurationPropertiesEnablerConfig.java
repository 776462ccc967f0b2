package com.purchasingpower.contextgraph.config;

import com.purchasingpower.contextgraph.configuration.ContextGraphProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that enables the {@code app.graph} configuration properties.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link ContextGraphProperties} - storage, sources, inference, retrieval and embedding settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties(ContextGraphProperties.class)
public class ConfigurationPropertiesEnablerConfig {
}
