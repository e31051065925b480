package com.flowgraph.core.renderer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RenderResultTest {

    @Test
    void succeeded_onlyForExitZeroWithoutTimeout() {
        assertThat(RenderResult.success("").succeeded()).isTrue();
        assertThat(new RenderResult(2, false, "").succeeded()).isFalse();
        assertThat(RenderResult.timeout("").succeeded()).isFalse();
    }

    @Test
    void describeFailure_timeout_mentionsConfiguredTimeout() {
        assertThat(RenderResult.timeout("partial").describeFailure(120))
            .isEqualTo("renderer timed out after 120s");
    }

    @Test
    void describeFailure_exitCode_includesFirstNonBlankLine() {
        RenderResult result = new RenderResult(1, false, "\n  Warning: bad label  \nsecond\n");

        assertThat(result.describeFailure(5)).isEqualTo("renderer exited with code 1: Warning: bad label");
    }

    @Test
    void describeFailure_noOutput_onlyExitCode() {
        assertThat(new RenderResult(127, false, null).describeFailure(5))
            .isEqualTo("renderer exited with code 127");
    }
}
