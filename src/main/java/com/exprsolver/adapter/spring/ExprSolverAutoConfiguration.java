package com.exprsolver.adapter.spring;

import com.exprsolver.config.ConfigLoader;
import com.exprsolver.config.SolverConfig;
import com.exprsolver.solver.ExpressionSolver;
import com.exprsolver.solver.SolveResultJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the expression solver.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "solver", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ExprSolverProperties.class)
public class ExprSolverAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExprSolverAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SolverConfig solverConfig(ExprSolverProperties properties) {
        log.info("Loading solver configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionSolver expressionSolver(SolverConfig config) {
        log.info("Creating ExpressionSolver: precision={}, latex={}, division={}",
                config.precision(), config.latexStyle(), config.divisionStyle());
        return new ExpressionSolver(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public SolveResultJsonWriter solveResultJsonWriter() {
        return new SolveResultJsonWriter();
    }
}
