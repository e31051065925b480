package com.flowgraph.core.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds the available {@link DiagramGenerator}s and selects the ones to run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GeneratorRegistry registry = GeneratorRegistry.discover();
 * List<DiagramGenerator> active = registry.select(List.of(), settings); // all applicable
 * }</pre>
 */
public class GeneratorRegistry {

    private static final Logger log = LoggerFactory.getLogger(GeneratorRegistry.class);

    private final List<DiagramGenerator> generators;

    /**
     * Creates a registry over the given generators.
     *
     * @param generators generators; ids must be unique
     * @throws IllegalArgumentException if two generators share an id
     */
    public GeneratorRegistry(Collection<? extends DiagramGenerator> generators) {
        Objects.requireNonNull(generators, "generators must not be null");
        List<DiagramGenerator> sorted = new ArrayList<>(generators);
        sorted.sort(Comparator.comparing(DiagramGenerator::getId));
        Set<String> ids = sorted.stream().map(DiagramGenerator::getId).collect(Collectors.toSet());
        if (ids.size() != sorted.size()) {
            throw new IllegalArgumentException("Duplicate generator ids in " + sorted.stream().map(DiagramGenerator::getId).toList());
        }
        this.generators = List.copyOf(sorted);
    }

    /**
     * Discovers all generators registered via ServiceLoader.
     *
     * @return registry of discovered generators
     */
    public static GeneratorRegistry discover() {
        log.debug("Discovering diagram generators via ServiceLoader");
        List<DiagramGenerator> found = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(found::add);
        log.info("Discovered {} diagram generators", found.size());
        if (log.isDebugEnabled()) {
            found.forEach(g -> log.debug("  - {} ({})", g.getId(), g.getDisplayName()));
        }
        return new GeneratorRegistry(found);
    }

    /**
     * Returns all generators, sorted by id.
     *
     * @return generators
     */
    public List<DiagramGenerator> all() {
        return generators;
    }

    /**
     * Selects the generators to run.
     *
     * @param enabledIds ids to run; empty means all
     * @param settings diagram settings, used for {@link DiagramGenerator#appliesTo(DiagramSettings)}
     * @return enabled and applicable generators, sorted by id
     */
    public List<DiagramGenerator> select(Collection<String> enabledIds, DiagramSettings settings) {
        Set<String> known = generators.stream().map(DiagramGenerator::getId).collect(Collectors.toSet());
        List<String> unknown = enabledIds.stream().filter(id -> !known.contains(id)).toList();
        if (!unknown.isEmpty()) {
            log.warn("Unknown generator IDs in configuration: {}. Available: {}", unknown, known);
        }

        List<DiagramGenerator> selected = new ArrayList<>();
        for (DiagramGenerator generator : generators) {
            if (!enabledIds.isEmpty() && !enabledIds.contains(generator.getId())) {
                log.debug("Generator {} is disabled in configuration", generator.getId());
            } else if (!generator.appliesTo(settings)) {
                log.debug("Generator {} does not apply to the current settings", generator.getId());
            } else {
                selected.add(generator);
            }
        }
        return selected;
    }
}
