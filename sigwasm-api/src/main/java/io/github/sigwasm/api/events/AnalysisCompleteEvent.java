package io.github.sigwasm.api.events;

import io.github.sigwasm.core.analysis.ComponentAnalysis;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the component has been analyzed, before any handler is compiled.
 */
public class AnalysisCompleteEvent implements ComponentCompileEvent {
    @NotNull
    public final ComponentAnalysis analysis;

    public AnalysisCompleteEvent(@NotNull ComponentAnalysis analysis) {
        this.analysis = analysis;
    }
}
