package com.purchasingpower.codelod.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.codelod.cli.CommandOutput;
import com.purchasingpower.codelod.core.CodeLodPaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;

/**
 * Wires the explicit configuration objects handed to the tracker, the sidecar synchronizer and the commands.
 */
@Slf4j
@Configuration
public class CodeLodConfiguration {

    @Bean
    public CodeLodPaths codeLodPaths(CodeLodProperties properties) {
        CodeLodPaths paths = CodeLodPaths.of(Path.of(properties.getRootDir()));
        log.info("Project root: {} (initialized: {})", paths.rootDir(), paths.isInitialized());
        return paths;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * For {@code .code-lod/config.yml} and the {@code config} command.
     */
    @Bean
    public YAMLMapper yamlMapper() {
        YAMLMapper mapper = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public CommandOutput commandOutput() {
        return new CommandOutput(System.out, System.err);
    }
}
