package com.flowgraph.core.output;

import com.flowgraph.core.generator.GeneratedDiagram;
import com.flowgraph.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes DOT artifacts into a prepared run directory.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputLayout layout = new OutputDirectoryManager().prepare(Path.of("/tmp/out"), "images_utopia");
 * ArtifactWriter writer = new ArtifactWriter(layout);
 * Path dot = writer.write(new GeneratedDiagram("commodities/commodity_ELC", "strict digraph ..."));
 * // Creates: /tmp/out/images_utopia/commodities/commodity_ELC.dot
 * }</pre>
 */
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private final OutputLayout layout;

    public ArtifactWriter(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
    }

    /**
     * Writes the artifact of a diagram, replacing any existing file.
     *
     * @param diagram generated diagram
     * @return absolute path of the written artifact
     * @throws IOException if the file cannot be written
     */
    public Path write(GeneratedDiagram diagram) throws IOException {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Path target = layout.resolve(diagram.artifactPath());
        log.debug("Writing artifact: {}", target);
        FileUtils.writeString(target, diagram.content());
        log.debug("Wrote artifact: {} ({} chars)", diagram.artifactPath(), diagram.content().length());
        return target;
    }

    /**
     * Returns the absolute path where the image of a diagram is rendered.
     *
     * @param diagram generated diagram
     * @param imageFormat image format
     * @return absolute image path
     */
    public Path imagePath(GeneratedDiagram diagram, String imageFormat) {
        return layout.resolve(diagram.imagePath(imageFormat));
    }

    public OutputLayout layout() {
        return layout;
    }
}
