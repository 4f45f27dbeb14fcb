package com.vectorpipeline.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static AppConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.info("Config file {} not found, using defaults", config);
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        validate(loaded);
        return loaded;
    }

    static void validate(AppConfig config) {
        if (config.getSparse().getBucketCount() <= 0) {
            throw new IllegalArgumentException("sparse.bucketCount must be > 0");
        }
        if (config.getEmbedding().getOutputDimensionality() <= 0) {
            throw new IllegalArgumentException("embedding.outputDimensionality must be > 0");
        }
        if (config.getSearch().getDefaultTopK() <= 0) {
            throw new IllegalArgumentException("search.defaultTopK must be > 0");
        }
        if (config.getSearch().getMetadataScanThreads() <= 0 || config.getSparse().getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("thread counts must be > 0");
        }
        try {
            ZoneId.of(config.getFilters().getTimestampZone());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("filters.timestampZone is not a valid zone id: "
                    + config.getFilters().getTimestampZone(), e);
        }
    }
}
