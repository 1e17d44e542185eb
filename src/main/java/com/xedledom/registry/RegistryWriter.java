package com.xedledom.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xedledom.civitai.model.ModelRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the registry file: a JSON object of identifier -> record, UTF-8, indented.
 */
public class RegistryWriter {

    private static final Logger log = LoggerFactory.getLogger(RegistryWriter.class);
    private static final TypeReference<LinkedHashMap<String, ModelRecord>> REGISTRY_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RegistryWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(Path file, Map<String, ModelRecord> registry) throws RegistryWriteException {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, new LinkedHashMap<>(registry));
            }
            log.info("Registry saved: {} ({} entries)", file, registry.size());
        } catch (IOException e) {
            throw new RegistryWriteException("Failed to save registry " + file + ": " + e.getMessage(), e);
        }
    }

    public Map<String, ModelRecord> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try (var in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, ModelRecord> registry = mapper.readValue(in, REGISTRY_TYPE);
            return registry == null ? new LinkedHashMap<>() : registry;
        }
    }
}
