package com.tiergate.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Tiergate.
 */
@ConfigurationProperties(prefix = "tiergate")
public class GateProperties {

    /**
     * Whether Tiergate is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Tiergate configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:tiergate.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
