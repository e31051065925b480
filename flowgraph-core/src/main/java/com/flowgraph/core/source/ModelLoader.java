package com.flowgraph.core.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flowgraph.core.model.EnergySystem;
import com.flowgraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@link EnergySystem} datasets from JSON or YAML files.
 *
 * <p>The format is chosen by file extension: {@code .json} is read as JSON, anything
 * else as YAML (a superset of JSON). Several datasets can be loaded together; they are
 * merged in the given order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EnergySystem system = ModelLoader.load(List.of(Path.of("utopia.yaml")));
 * EnergySystemQuery query = new IndexedEnergySystem(system);
 * }</pre>
 */
public final class ModelLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ModelLoader() {
        // Utility class
    }

    /**
     * Loads a single dataset file.
     *
     * @param datasetPath dataset file
     * @return dataset; its name defaults to the file base name
     * @throws IOException if the file cannot be read or parsed
     */
    public static EnergySystem load(Path datasetPath) throws IOException {
        Objects.requireNonNull(datasetPath, "datasetPath must not be null");
        if (!Files.isRegularFile(datasetPath)) {
            throw new IOException("Dataset file not found: " + datasetPath);
        }

        ObjectMapper mapper = "json".equalsIgnoreCase(FileUtils.getExtension(datasetPath)) ? JSON_MAPPER : YAML_MAPPER;
        log.debug("Loading dataset from: {}", datasetPath);
        EnergySystem system = mapper.readValue(datasetPath.toFile(), EnergySystem.class);
        if (system == null) {
            throw new IOException("Dataset file is empty: " + datasetPath);
        }

        if (system.name() == null) {
            system = new EnergySystem(FileUtils.getBaseName(datasetPath), system.periods(), system.optimizePeriods(),
                system.seasons(), system.timesOfDay(), system.technologies(), system.carriers(), system.emissions(),
                system.efficiencies(), system.processes(), system.capacities(), system.periodCapacities(),
                system.vintageActivities(), system.flows(), system.emissionActivities(), system.emissionTotals());
        }

        log.info("Loaded dataset '{}' from {} ({} efficiencies, {} processes, {} flows)",
            system.name(), datasetPath, system.efficiencies().size(), system.processes().size(), system.flows().size());
        return system;
    }

    /**
     * Loads and merges several dataset files.
     *
     * @param datasetPaths dataset files, at least one
     * @return merged dataset, named after the first file
     * @throws IOException if any file cannot be read or parsed
     */
    public static EnergySystem load(List<Path> datasetPaths) throws IOException {
        Objects.requireNonNull(datasetPaths, "datasetPaths must not be null");
        if (datasetPaths.isEmpty()) {
            throw new IllegalArgumentException("At least one dataset file is required");
        }

        EnergySystem merged = load(datasetPaths.get(0));
        for (Path path : datasetPaths.subList(1, datasetPaths.size())) {
            merged = merged.merge(load(path));
        }
        return merged;
    }
}
