package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.shared.PlannerSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class TrainingTablesConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TrainingTablesConfiguration.class);

    @Bean
    public TrainingTables trainingTables(ObjectMapper objectMapper, PlannerSettings settings) throws IOException {
        TrainingTables tables = TrainingTables.load(objectMapper, settings.tablesResource());
        logger.info("Loaded training tables from {}", settings.tablesResource());
        return tables;
    }
}
