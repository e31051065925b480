package com.flowgraph.core.job;

import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.source.EnergySystemQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands generators into one job per scope.
 */
public class JobPlanner {

    private static final Logger log = LoggerFactory.getLogger(JobPlanner.class);

    /**
     * Lists the scopes of every generator and turns each into a job.
     *
     * <p>A generator that fails to list its scopes is logged and reported in the plan;
     * the other generators are still planned.
     *
     * @param generators generators to run
     * @param query model queries
     * @param settings diagram settings
     * @return planned jobs
     */
    public JobPlan plan(List<DiagramGenerator> generators, EnergySystemQuery query, DiagramSettings settings) {
        Objects.requireNonNull(generators, "generators must not be null");
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        List<DiagramJob> jobs = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Map<String, Integer> perGenerator = new HashMap<>();

        for (DiagramGenerator generator : generators) {
            List<ScopeKey> scopes;
            try {
                scopes = generator.scopes(query, settings);
            } catch (RuntimeException e) {
                log.error("Generator {} failed to list its scopes", generator.getId(), e);
                failed.add(generator.getId());
                continue;
            }
            for (ScopeKey scope : scopes) {
                jobs.add(new DiagramJob(generator, scope));
            }
            perGenerator.put(generator.getId(), scopes.size());
        }

        log.info("Planned {} diagram jobs from {} generators", jobs.size(), generators.size());
        log.debug("Jobs per generator: {}", perGenerator);
        return new JobPlan(jobs, failed);
    }
}
