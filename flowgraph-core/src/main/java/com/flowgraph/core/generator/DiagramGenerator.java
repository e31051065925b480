package com.flowgraph.core.generator;

import com.flowgraph.core.source.EnergySystemQuery;

import java.util.List;
import java.util.Optional;

/**
 * A family of diagrams: expands into one scope per diagram and draws each scope.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). Each
 * {@link ScopeKey} returned by {@link #scopes(EnergySystemQuery, DiagramSettings)} becomes
 * one independent diagram job; jobs of the same generator may run concurrently, so
 * {@link #generate(EnergySystemQuery, ScopeKey, DiagramSettings)} must not keep state
 * between calls.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CommodityGenerator implements DiagramGenerator {
 *     public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
 *         return query.carriers().stream().map(c -> ScopeKey.of(getId(), "commodity", c)).toList();
 *     }
 *
 *     public Optional<GeneratedDiagram> generate(EnergySystemQuery query, ScopeKey scope,
 *                                                DiagramSettings settings) {
 *         GraphSetBuilder<Node> techs = GraphSetBuilder.nodes();
 *         ...
 *         return Optional.of(new GeneratedDiagram("commodities/commodity_" + c, writer.build()));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.flowgraph.core.generator.DiagramGenerator}
 *
 * @see GeneratorRegistry
 * @see ScopeKey
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for enabling the generator in configuration and in scope keys. Lowercase
     * with dashes (e.g. "commodity", "tech-results").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the diagram family, which decides the output directory.
     *
     * @return category
     */
    DiagramCategory getCategory();

    /**
     * Returns true if this generator should run with the given settings.
     *
     * <p>Used to choose between alternative generators for the same output, such as the
     * two process layouts.
     *
     * @param settings diagram settings
     * @return true if applicable
     */
    default boolean appliesTo(DiagramSettings settings) {
        return true;
    }

    /**
     * Lists the scopes to draw, one per diagram.
     *
     * @param query model queries
     * @param settings diagram settings
     * @return scope keys in a deterministic order
     */
    List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings);

    /**
     * Draws one scope.
     *
     * <p>Returns an empty optional when the scope has nothing to draw, for example a
     * declared technology that no process uses. That is not an error.
     *
     * @param query model queries
     * @param scope scope to draw, owned by this generator
     * @param settings diagram settings
     * @return diagram, or empty if there is nothing to draw
     * @throws IllegalArgumentException if the scope belongs to another generator
     */
    Optional<GeneratedDiagram> generate(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings);
}
