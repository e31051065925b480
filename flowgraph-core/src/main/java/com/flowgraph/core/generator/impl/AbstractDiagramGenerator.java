package com.flowgraph.core.generator.impl;

import com.flowgraph.core.dot.DotAttributes;
import com.flowgraph.core.dot.DotWriter;
import com.flowgraph.core.generator.DiagramCategory;
import com.flowgraph.core.generator.DiagramGenerator;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.generator.ScopeKey;
import com.flowgraph.core.source.EnergySystemQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for the built-in generators.
 *
 * <p>Validates arguments and scope ownership, and provides the document header, link and
 * number formatting shared by all diagrams. Subclasses implement {@link #draw}.
 */
abstract class AbstractDiagramGenerator implements DiagramGenerator {

    /** Edge label that keeps Graphviz from drawing edges too short to see. */
    static final String SPACER_LABEL = "   ";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String id;
    private final String displayName;
    private final DiagramCategory category;

    protected AbstractDiagramGenerator(String id, String displayName, DiagramCategory category) {
        this.id = id;
        this.displayName = displayName;
        this.category = category;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public DiagramCategory getCategory() {
        return category;
    }

    @Override
    public final Optional<GeneratedDiagram> generate(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        if (!id.equals(scope.generatorId())) {
            throw new IllegalArgumentException("Scope " + scope + " does not belong to generator " + id);
        }

        Optional<GeneratedDiagram> diagram = draw(query, scope, settings);
        if (diagram.isEmpty()) {
            log.debug("Nothing to draw for {}", scope);
        }
        return diagram;
    }

    /**
     * Draws one scope owned by this generator.
     *
     * @param query model queries
     * @param scope scope to draw
     * @param settings diagram settings
     * @return diagram, or empty if the scope has nothing to draw
     */
    protected abstract Optional<GeneratedDiagram> draw(EnergySystemQuery query, ScopeKey scope, DiagramSettings settings);

    /**
     * Starts a document with the generated-file header.
     *
     * @param name file name of the diagram, without extension
     * @param subject what the diagram shows, used in the header
     * @param settings diagram settings
     * @return writer positioned before the graph statement
     */
    protected DotWriter newDocument(String name, String subject, DiagramSettings settings) {
        String format = settings.imageFormat();
        return new DotWriter()
            .comment("Generated by flowgraph. Graphviz DOT description of " + subject + ".\n"
                + "Render with: dot -T" + format + " -o " + name + "." + format + " " + name + ".dot")
            .blankLine();
    }

    /**
     * Wraps a finished document as a diagram in this generator's category.
     */
    protected Optional<GeneratedDiagram> diagram(String name, DotWriter writer) {
        return Optional.of(new GeneratedDiagram(category.resolve(name), writer.build()));
    }

    /**
     * Returns the image path of another diagram, relative to this generator's directory.
     */
    protected String link(DiagramCategory target, String name, DiagramSettings settings) {
        return DiagramNames.link(category, target, name, settings.imageFormat());
    }

    protected static DotAttributes href(String link) {
        return DotAttributes.create().add("href", link);
    }

    protected static DotAttributes flowLabel(double value) {
        return DotAttributes.create().add("label", format(value));
    }

    /**
     * Formats a quantity with two decimals, independent of the default locale.
     */
    protected static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
