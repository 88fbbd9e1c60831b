package io.github.sigwasm.api;

import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.assemble.CompiledModule;

/**
 * Everything a page needs to run a component: its server-rendered HTML, its module, and how the two connect.
 */
public final class CompiledComponent {
    private final ComponentAnalysis analysis;
    private final CompiledModule module;
    private final HydrationManifest manifest;

    public CompiledComponent(ComponentAnalysis analysis, CompiledModule module, HydrationManifest manifest) {
        this.analysis = analysis;
        this.module = module;
        this.manifest = manifest;
    }

    public ComponentAnalysis getAnalysis() {
        return analysis;
    }

    public CompiledModule getModule() {
        return module;
    }

    public HydrationManifest getManifest() {
        return manifest;
    }

    /**
     * Get the HTML of the dry run, whose {@code data-hk} attributes the module's callbacks refer to.
     *
     * @return The HTML.
     */
    public String getHtml() {
        return analysis.getHtml();
    }

    public byte[] getWasm() {
        return module.getBytes();
    }
}
