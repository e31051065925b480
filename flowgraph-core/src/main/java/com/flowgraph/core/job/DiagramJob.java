package com.flowgraph.core.job;

import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.ScopeKey;

import java.util.Objects;

/**
 * One unit of work: draw, write and render a single scope of a generator.
 *
 * @param generator generator that owns the scope
 * @param scope scope to draw
 */
public record DiagramJob(
    DiagramGenerator generator,
    ScopeKey scope
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramJob {
        Objects.requireNonNull(generator, "generator must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        if (!generator.getId().equals(scope.generatorId())) {
            throw new IllegalArgumentException("Scope " + scope + " does not belong to generator " + generator.getId());
        }
    }

    @Override
    public String toString() {
        return scope.toString();
    }
}
