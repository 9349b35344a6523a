package com.gillianbc.lifemodel.config;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a YAML overlay file and merges it over the embedded defaults.
 * <p>
 * A missing, unreadable or malformed file is not fatal: a warning is logged and
 * the embedded defaults are returned instead.
 */
@Slf4j
public final class FinancialConfigLoader {

    private FinancialConfigLoader() {
    }

    public static FinancialConfig load(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        FinancialConfig defaults = FinancialConfig.defaults();

        if (!Files.isReadable(file)) {
            log.warn("Financial configuration file {} not found, using embedded defaults", file.toAbsolutePath());
            return defaults;
        }

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Object parsed = new Yaml().load(reader);
            if (parsed == null) {
                log.warn("Financial configuration file {} is empty, using embedded defaults", file.toAbsolutePath());
                return defaults;
            }
            if (!(parsed instanceof Map<?, ?>)) {
                log.warn("Financial configuration file {} does not contain a mapping, using embedded defaults",
                        file.toAbsolutePath());
                return defaults;
            }
            FinancialConfig config = defaults.withOverrides((Map<?, ?>) parsed).validate();
            log.info("Loaded financial configuration from {}", file.toAbsolutePath());
            return config;
        } catch (IOException | YAMLException | IllegalArgumentException e) {
            log.warn("Invalid financial configuration in {}, using embedded defaults: {}",
                    file.toAbsolutePath(), e.getMessage());
            return defaults;
        }
    }
}
