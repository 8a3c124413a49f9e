package com.stratlab.core.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stratlab.core.model.Strategy;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads and writes Strategy JSON files.
 * Each strategy is one file named after it: {strategiesDir}/{name}.json
 */
public class StrategyStore extends JsonStore<Strategy> {

    private static final ObjectMapper READER = createMapper();

    public StrategyStore(File directory) {
        super(directory);
    }

    @Override
    protected Class<Strategy> getEntityClass() {
        return Strategy.class;
    }

    @Override
    protected String getEntityName() {
        return "strategy";
    }

    @Override
    protected String keyOf(Strategy strategy) {
        return strategy.name();
    }

    /**
     * Names of all stored strategies, sorted.
     */
    public List<String> listNames() {
        return loadAll().stream().map(Strategy::name).sorted().toList();
    }

    /**
     * Read a strategy document from an arbitrary file. Needs no store
     * directory, so nothing is created on disk.
     */
    public static Strategy readFile(File file) {
        try {
            return READER.readValue(file, Strategy.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read strategy from " + file, e);
        }
    }

    public String toJson(Strategy strategy) {
        try {
            return mapper.writeValueAsString(strategy);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize strategy " + strategy.name(), e);
        }
    }

    public Strategy fromJson(String json) {
        try {
            return mapper.readValue(json, Strategy.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse strategy JSON", e);
        }
    }
}
