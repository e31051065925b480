package com.flowgraph.core.renderer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a DOT artifact into an image.
 *
 * <p>Implementations must bound the time they take: a renderer that never returns would
 * hold a worker slot forever.
 *
 * @see GraphvizRenderer
 */
public interface RendererInvoker {

    /**
     * Renders an artifact.
     *
     * @param artifact absolute path of the DOT file
     * @param image absolute path of the image to produce
     * @param format image format, e.g. {@code svg}
     * @return result of the invocation; a failed render is a result, not an exception
     * @throws IOException if the renderer could not be started
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    RenderResult render(Path artifact, Path image, String format) throws IOException, InterruptedException;

    /**
     * Returns the maximum time one invocation may take, in seconds.
     *
     * @return timeout in seconds
     */
    long timeoutSeconds();
}
