package com.agentvet.config;

import com.agentvet.validation.integrity.HashRegistry;
import com.agentvet.validation.integrity.JsonFileHashRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class RegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    @Bean
    public HashRegistry hashRegistry(AgentvetProperties properties, ObjectMapper objectMapper) {
        AgentvetProperties.IntegrityProperties integrity = properties.getIntegrity();
        String root = integrity.getRoot();
        Path rootPath = root == null || root.isBlank()
                ? Path.of(System.getProperty("user.dir"))
                : Path.of(root);
        JsonFileHashRegistry registry = new JsonFileHashRegistry(rootPath, Path.of(integrity.getRegistryPath()), objectMapper);
        log.info("Hash registry file: {}", registry.getFile());
        return registry;
    }
}
