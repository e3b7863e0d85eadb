package com.scout.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scout.core.model.PropertyDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads one property's cleaned dataset from JSON.
 *
 * <p>
 * Unknown fields are ignored. A document without {@code client_metadata.property_id}
 * or without a {@code clean_dataset} array is rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class PropertyDatasetReader {

    private static final Logger LOG = LoggerFactory.getLogger(PropertyDatasetReader.class);

    private final ObjectMapper mapper;

    public PropertyDatasetReader() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param file property JSON file
     * @return the parsed dataset
     * @throws PropertyLoadException if the file is unreadable, malformed or incomplete
     */
    public PropertyDataset read(Path file) throws PropertyLoadException {
        Objects.requireNonNull(file, "file must not be null");
        String source = file.getFileName().toString();
        try (InputStream in = Files.newInputStream(file)) {
            return read(source, in);
        } catch (IOException e) {
            throw new PropertyLoadException(source, "unable to read file", e);
        }
    }

    /**
     * @param source name used in errors and logs
     * @param in     JSON stream; not closed by this method
     * @return the parsed dataset
     * @throws PropertyLoadException if the document is malformed or incomplete
     */
    public PropertyDataset read(String source, InputStream in) throws PropertyLoadException {
        PropertyDataset dataset;
        try {
            dataset = mapper.readValue(in, PropertyDataset.class);
        } catch (JsonProcessingException e) {
            throw new PropertyLoadException(source, "malformed property JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PropertyLoadException(source, "unable to read property JSON", e);
        }
        if (dataset == null) {
            throw new PropertyLoadException(source, "empty document");
        }
        String propertyId = dataset.getPropertyId();
        if (propertyId == null || propertyId.isBlank()) {
            throw new PropertyLoadException(source, "client_metadata.property_id is missing");
        }
        if (dataset.getCleanDataset() == null) {
            throw new PropertyLoadException(source, "clean_dataset is missing");
        }
        LOG.debug("Read property {} from {}: {} daily rows", propertyId, source, dataset.getCleanDataset().size());
        return dataset;
    }
}
