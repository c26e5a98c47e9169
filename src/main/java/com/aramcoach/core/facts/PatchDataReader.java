package com.aramcoach.core.facts;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves and parses the JSON files of a patch directory.
 */
@Component
public class PatchDataReader {

    private static final Logger log = LoggerFactory.getLogger(PatchDataReader.class);

    /** Patch ids look like "14.99" or "14.99b"; anything else could escape the data directory. */
    private static final Pattern SAFE_PATCH_ID = Pattern.compile("[0-9A-Za-z][0-9A-Za-z._-]{0,31}");

    private final ResourceLoader resourceLoader;
    private final DataProperties properties;
    private final ObjectMapper objectMapper;

    public PatchDataReader(ResourceLoader resourceLoader, DataProperties properties, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a required file. A missing file means the patch does not exist.
     */
    public <T> T readRequired(String patchId, String fileName, TypeReference<T> type) {
        Resource resource = resolve(patchId, fileName);
        if (!resource.exists()) {
            throw new PatchNotFoundException(patchId);
        }
        return parse(patchId, fileName, resource, type);
    }

    /**
     * Reads an optional file; empty if it does not exist.
     */
    public <T> Optional<T> readOptional(String patchId, String fileName, TypeReference<T> type) {
        Resource resource = resolve(patchId, fileName);
        if (!resource.exists()) {
            log.debug("Optional file {} not present for patch {}", fileName, patchId);
            return Optional.empty();
        }
        return Optional.of(parse(patchId, fileName, resource, type));
    }

    private Resource resolve(String patchId, String fileName) {
        if (patchId == null || !SAFE_PATCH_ID.matcher(patchId).matches() || patchId.contains("..")) {
            throw new PatchNotFoundException(patchId);
        }
        String base = properties.getLocation().endsWith("/")
                ? properties.getLocation()
                : properties.getLocation() + "/";
        return resourceLoader.getResource(base + patchId + "/" + fileName);
    }

    private <T> T parse(String patchId, String fileName, Resource resource, TypeReference<T> type) {
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            if (value == null) {
                throw new DataCorruptException(fileName + " for patch " + patchId + " is empty");
            }
            return value;
        } catch (IOException e) {
            throw new DataCorruptException("Failed to read " + fileName + " for patch " + patchId
                    + ": " + e.getMessage(), e);
        }
    }
}
