package com.exprsolver.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the expression solver.
 */
@ConfigurationProperties(prefix = "solver")
public class ExprSolverProperties {

    /**
     * Whether the solver beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the solver configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:exprsolver.yaml";

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
