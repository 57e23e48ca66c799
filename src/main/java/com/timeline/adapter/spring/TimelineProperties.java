package com.timeline.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code timeline.*} properties.
 */
@ConfigurationProperties(prefix = "timeline")
public class TimelineProperties {

    /**
     * Set to false to keep the scheduling beans out of the context.
     */
    private boolean enabled = true;

    /**
     * YAML file holding the date rule groups and the task catalog,
     * either {@code classpath:...} or a file system path.
     */
    private String configPath = "classpath:timeline.yaml";

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
