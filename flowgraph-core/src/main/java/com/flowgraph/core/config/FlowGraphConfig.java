package com.flowgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowgraph.core.dispatch.ExecutionMode;
import com.flowgraph.core.generator.DiagramSettings;
import com.flowgraph.core.generator.Palette;
import com.flowgraph.core.generator.ProcessLayout;
import com.flowgraph.core.renderer.GraphvizRenderer;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration for flowgraph runs.
 *
 * <p>Loaded from {@code flowgraph.yaml}. Every section and every field is optional;
 * missing values fall back to the defaults documented on each accessor.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * output:
 *   directory: "./diagrams"
 *   imageFormat: png
 *
 * dispatch:
 *   concurrency: 4
 *   mode: parallel
 *
 * renderer:
 *   command: dot
 *   timeoutSeconds: 60
 *
 * diagram:
 *   flowThreshold: 0.01
 *   processLayout: explicit_vintages
 *   showCapacity: true
 *   splines: ortho
 *
 * generators:
 *   enabled:
 *     - system-overview
 *     - commodity
 *
 * palette:
 *   tech: darkseagreen
 *   rainbow: [red, orange, gold]
 * }</pre>
 *
 * @param output output configuration
 * @param dispatch job dispatch configuration
 * @param renderer renderer configuration
 * @param diagram diagram content configuration
 * @param generators generator selection
 * @param palette colour overrides
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowGraphConfig(
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("dispatch") DispatchConfig dispatch,
    @JsonProperty("renderer") RendererConfig renderer,
    @JsonProperty("diagram") DiagramConfig diagram,
    @JsonProperty("generators") GeneratorSelection generators,
    @JsonProperty("palette") PaletteConfig palette
) {
    /**
     * Compact constructor; missing sections become empty sections.
     */
    public FlowGraphConfig {
        output = output == null ? new OutputConfig(null, null) : output;
        dispatch = dispatch == null ? new DispatchConfig(null, null) : dispatch;
        renderer = renderer == null ? new RendererConfig(null, null) : renderer;
        diagram = diagram == null ? new DiagramConfig(null, null, null, null) : diagram;
        generators = generators == null ? new GeneratorSelection(null) : generators;
        palette = palette == null ? PaletteConfig.empty() : palette;
    }

    /**
     * Creates the default configuration: svg images in the working directory, one worker
     * per processor, {@code dot} with a 120 second timeout, all generators.
     *
     * @return default configuration
     */
    public static FlowGraphConfig defaults() {
        return new FlowGraphConfig(null, null, null, null, null, null);
    }

    /**
     * Resolves the settings shared by all diagram jobs.
     *
     * @return diagram settings
     * @throws IllegalArgumentException if a configured value is invalid
     */
    public DiagramSettings toDiagramSettings() {
        return new DiagramSettings(
            output.effectiveImageFormat(),
            diagram.effectiveFlowThreshold(),
            diagram.effectiveProcessLayout(),
            diagram.effectiveShowCapacity(),
            diagram.effectiveSplines(),
            palette.toPalette()
        );
    }

    /**
     * Output configuration.
     *
     * @param directory parent of the run directory (default: working directory)
     * @param imageFormat renderer output format (default: svg)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("imageFormat") String imageFormat
    ) {
        public String effectiveDirectory() {
            return directory == null || directory.isBlank() ? "." : directory;
        }

        public String effectiveImageFormat() {
            return imageFormat == null || imageFormat.isBlank() ? "svg" : imageFormat.strip().toLowerCase();
        }
    }

    /**
     * Dispatch configuration.
     *
     * @param concurrency worker count (default: available processors)
     * @param mode execution mode (default: PARALLEL)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DispatchConfig(
        @JsonProperty("concurrency") Integer concurrency,
        @JsonProperty("mode") ExecutionMode mode
    ) {
        public int effectiveConcurrency() {
            return concurrency == null ? Runtime.getRuntime().availableProcessors() : concurrency;
        }

        public ExecutionMode effectiveMode() {
            return mode == null ? ExecutionMode.PARALLEL : mode;
        }
    }

    /**
     * Renderer configuration.
     *
     * @param command renderer command (default: dot)
     * @param timeoutSeconds per-invocation timeout (default: 120)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RendererConfig(
        @JsonProperty("command") String command,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds
    ) {
        public String effectiveCommand() {
            return command == null || command.isBlank() ? GraphvizRenderer.DEFAULT_COMMAND : command;
        }

        public Duration effectiveTimeout() {
            return timeoutSeconds == null ? GraphvizRenderer.DEFAULT_TIMEOUT : Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Diagram content configuration.
     *
     * @param flowThreshold smallest flow drawn as in use (default: 0.005)
     * @param processLayout process diagram layout (default: SEPARATE_VINTAGES)
     * @param showCapacity label process diagrams with capacities (default: false)
     * @param splines Graphviz splines value (default: "true")
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramConfig(
        @JsonProperty("flowThreshold") Double flowThreshold,
        @JsonProperty("processLayout") ProcessLayout processLayout,
        @JsonProperty("showCapacity") Boolean showCapacity,
        @JsonProperty("splines") String splines
    ) {
        public double effectiveFlowThreshold() {
            return flowThreshold == null ? DiagramSettings.DEFAULT_FLOW_THRESHOLD : flowThreshold;
        }

        public ProcessLayout effectiveProcessLayout() {
            return processLayout == null ? ProcessLayout.SEPARATE_VINTAGES : processLayout;
        }

        public boolean effectiveShowCapacity() {
            return Boolean.TRUE.equals(showCapacity);
        }

        public String effectiveSplines() {
            return splines == null || splines.isBlank() ? "true" : splines;
        }
    }

    /**
     * Generator selection.
     *
     * @param enabled ids of the generators to run; empty runs all of them
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSelection(
        @JsonProperty("enabled") List<String> enabled
    ) {
        public GeneratorSelection {
            enabled = enabled == null ? List.of() : List.copyOf(enabled);
        }
    }

    /**
     * Colour overrides; unset colours keep their {@link Palette#defaults() default}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaletteConfig(
        @JsonProperty("tech") String tech,
        @JsonProperty("commodity") String commodity,
        @JsonProperty("unused") String unused,
        @JsonProperty("inputArrow") String inputArrow,
        @JsonProperty("outputArrow") String outputArrow,
        @JsonProperty("usedFont") String usedFont,
        @JsonProperty("unusedFont") String unusedFont,
        @JsonProperty("incomingCommodity") String incomingCommodity,
        @JsonProperty("outgoingCommodity") String outgoingCommodity,
        @JsonProperty("vintageBackground") String vintageBackground,
        @JsonProperty("vintageNode") String vintageNode,
        @JsonProperty("usedFlow") String usedFlow,
        @JsonProperty("rainbow") List<String> rainbow
    ) {
        static PaletteConfig empty() {
            return new PaletteConfig(null, null, null, null, null, null, null, null, null, null, null, null, null);
        }

        /**
         * Merges the overrides into the default palette.
         *
         * @return palette
         */
        public Palette toPalette() {
            Palette d = Palette.defaults();
            return new Palette(
                or(tech, d.techColor()),
                or(commodity, d.commodityColor()),
                or(unused, d.unusedColor()),
                or(inputArrow, d.inputArrowColor()),
                or(outputArrow, d.outputArrowColor()),
                or(usedFont, d.usedFontColor()),
                or(unusedFont, d.unusedFontColor()),
                or(incomingCommodity, d.incomingCommodityColor()),
                or(outgoingCommodity, d.outgoingCommodityColor()),
                or(vintageBackground, d.clusterColor()),
                or(vintageNode, d.clusterNodeColor()),
                or(usedFlow, d.usedFlowColor()),
                rainbow == null || rainbow.isEmpty() ? d.rainbow() : rainbow
            );
        }

        private static String or(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value;
        }
    }
}
