package com.stratlab.core.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Generic base class for JSON file stores.
 *
 * Directory structure: {baseDir}/{key}.json
 *
 * @param <T> Entity type
 */
public abstract class JsonStore<T> {

    private static final String EXTENSION = ".json";

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final File directory;
    protected final ObjectMapper mapper;

    /**
     * Create a new JsonStore.
     *
     * @param directory Base directory for this store
     */
    protected JsonStore(File directory) {
        this.directory = directory;
        this.mapper = createMapper();

        if (!directory.exists()) {
            directory.mkdirs();
        }
    }

    /**
     * Mapper shared by all stores: java.time support, ISO dates, indented output,
     * unknown properties ignored.
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Get the entity class for deserialization.
     */
    protected abstract Class<T> getEntityClass();

    /**
     * Get a display name for this entity type (for logging).
     */
    protected abstract String getEntityName();

    /**
     * File key (name without extension) an entity is saved under.
     */
    protected abstract String keyOf(T entity);

    /**
     * Load all entities from the directory, ordered by file name.
     * Unreadable files are logged and skipped.
     */
    public List<T> loadAll() {
        List<T> entities = new ArrayList<>();
        File[] files = directory.listFiles((dir, name) -> name.endsWith(EXTENSION));

        if (files != null) {
            Arrays.sort(files, Comparator.comparing(File::getName));
            for (File file : files) {
                try {
                    entities.add(mapper.readValue(file, getEntityClass()));
                } catch (IOException e) {
                    log.error("Failed to load {} from {}: {}", getEntityName(), file, e.getMessage());
                }
            }
        }

        return entities;
    }

    /**
     * Load a single entity by key.
     *
     * @return The entity, or null if not found
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public T load(String key) {
        File file = getFile(key);
        if (!file.exists()) {
            return null;
        }

        try {
            return mapper.readValue(file, getEntityClass());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + getEntityName() + " " + key, e);
        }
    }

    /**
     * Save an entity to disk, replacing any previous file with the same key.
     *
     * @return the written file
     */
    public File save(T entity) {
        File file = getFile(keyOf(entity));

        try {
            mapper.writeValue(file, entity);
            log.info("Saved {} to: {}", getEntityName(), file.getAbsolutePath());
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save " + getEntityName() + " " + keyOf(entity), e);
        }
    }

    /**
     * Delete an entity's file.
     *
     * @return true if deleted successfully
     */
    public boolean delete(String key) {
        File file = getFile(key);
        return file.exists() && file.delete();
    }

    public boolean exists(String key) {
        return getFile(key).exists();
    }

    public File getFile(String key) {
        return new File(directory, fileKey(key) + EXTENSION);
    }

    public File getDirectory() {
        return directory;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Make a key safe to use as a file name.
     */
    protected static String fileKey(String key) {
        return key.replaceAll("[\\\\/:*?\"<>|]", "_").trim();
    }
}
