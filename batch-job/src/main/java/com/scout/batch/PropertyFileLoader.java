package com.scout.batch;

import com.scout.core.io.PropertyDatasetReader;
import com.scout.core.io.PropertyLoadException;
import com.scout.core.model.PropertyDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads every property file of the input directory.
 *
 * <p>
 * Files are read in name order. A file that cannot be loaded is logged and
 * recorded as a failure; the remaining files are still loaded. A second file
 * for an already loaded property id is skipped.
 * </p>
 */
public class PropertyFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PropertyFileLoader.class);

    private final PropertyDatasetReader reader;

    public PropertyFileLoader(PropertyDatasetReader reader) {
        this.reader = Objects.requireNonNull(reader, "PropertyDatasetReader must not be null");
    }

    /**
     * @param inputDir directory holding the property files
     * @param glob     file name pattern
     * @return loaded datasets and per-file failures
     * @throws IllegalArgumentException if {@code inputDir} is not a directory
     * @throws IllegalStateException    if the directory cannot be listed
     */
    public LoadResult loadAll(Path inputDir, String glob) {
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("Input directory not found: " + inputDir.toAbsolutePath());
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, glob)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list input directory: " + inputDir, e);
        }
        files.sort(Path::compareTo);
        LOG.info("Found {} property file(s) matching '{}' in {}", files.size(), glob, inputDir);

        List<PropertyDataset> datasets = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                PropertyDataset dataset = reader.read(file);
                if (!seen.add(dataset.getPropertyId())) {
                    LOG.warn("Skipping {}: property {} already loaded", name, dataset.getPropertyId());
                    continue;
                }
                datasets.add(dataset);
            } catch (PropertyLoadException e) {
                LOG.warn("Skipping property file {}: {}", e.getSource(), e.getMessage(), e);
                failures.put(name, e.getMessage());
            }
        }
        return new LoadResult(datasets, failures);
    }

    /** Outcome of loading the input directory. */
    public static final class LoadResult {
        private final List<PropertyDataset> datasets;
        private final Map<String, String> failures;

        LoadResult(List<PropertyDataset> datasets, Map<String, String> failures) {
            this.datasets = List.copyOf(datasets);
            this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }

        public List<PropertyDataset> getDatasets() {
            return datasets;
        }

        /** Failure message per file name. */
        public Map<String, String> getFailures() {
            return failures;
        }
    }
}
