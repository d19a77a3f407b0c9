package com.mcainsights.mcainsights.config;

import com.mcainsights.mcainsights.diff.DiffEngine;
import com.mcainsights.mcainsights.diff.DiffSettings;
import com.mcainsights.mcainsights.query.ChangeQueryParser;
import com.mcainsights.mcainsights.snapshot.DirectorySnapshotStore;
import com.mcainsights.mcainsights.snapshot.SnapshotStore;
import com.mcainsights.mcainsights.snapshot.ValueNormalizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Builds the normalizer, engine and snapshot store from bound properties so none of them reads global state.
 */
@Configuration
@EnableConfigurationProperties(ChangeDetectionProperties.class)
public class ChangeDetectionConfig {

    @Bean
    public ValueNormalizer valueNormalizer(ChangeDetectionProperties properties) {
        return new ValueNormalizer(
                properties.getNullTokens(),
                properties.getUpperCaseFields(),
                properties.getNumericFields()
        );
    }

    @Bean
    public DiffEngine diffEngine(ChangeDetectionProperties properties, ValueNormalizer valueNormalizer) {
        return new DiffEngine(new DiffSettings(
                properties.getTrackedFields(),
                properties.getNameField(),
                properties.getStateField(),
                properties.getStatusField(),
                valueNormalizer,
                properties.getParallelThreshold(),
                properties.getShardSize()
        ));
    }

    @Bean
    public SnapshotStore snapshotStore(ChangeDetectionProperties properties, ValueNormalizer valueNormalizer) {
        return new DirectorySnapshotStore(Path.of(properties.getSnapshotDir()), properties.getKeyField(), valueNormalizer);
    }

    @Bean
    public ChangeQueryParser changeQueryParser(ChangeDetectionProperties properties) {
        return new ChangeQueryParser(properties.getKnownStates());
    }
}
