package com.flowgraph.core;

import com.flowgraph.core.generator.DiagramCategory;
import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.job.DiagramJob;
import com.flowgraph.core.source.EnergySystemQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generator with a fixed number of numbered scopes, each drawing a trivial graph.
 */
public class StubGenerator implements DiagramGenerator {

    private final String id;
    private final int scopeCount;

    public StubGenerator(String id, int scopeCount) {
        this.id = id;
        this.scopeCount = scopeCount;
    }

    /**
     * Creates one job per scope of a new stub generator.
     */
    public static List<DiagramJob> jobs(int count) {
        StubGenerator generator = new StubGenerator("stub", count);
        List<DiagramJob> jobs = new ArrayList<>();
        for (ScopeKey scope : generator.scopes(null, null)) {
            jobs.add(new DiagramJob(generator, scope));
        }
        return jobs;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getDisplayName() {
        return "Stub " + id;
    }

    @Override
    public DiagramCategory getCategory() {
        return DiagramCategory.RESULTS;
    }

    @Override
    public List<ScopeKey> scopes(EnergySystemQuery query, DiagramSettings settings) {
        List<ScopeKey> scopes = new ArrayList<>();
        for (int i = 0; i < scopeCount; i++) {
            scopes.add(ScopeKey.of(id, "n", i));
        }
        return scopes;
    }

    @Override
    public Optional<GeneratedDiagram> generate(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        String name = id + "_" + scope.get("n");
        return Optional.of(new GeneratedDiagram(getCategory().resolve(name), "strict digraph " + name + " {\n}\n"));
    }
}
