package io.github.sigwasm.core.assemble;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Options for assembling a module.
 */
public final class CompilerOptions {
    public static final CompilerOptions DEFAULT = builder().build();

    private final NumericPolicy numericPolicy;
    private final String importModule;
    private final boolean exportSignalGlobals;

    private CompilerOptions(Builder builder) {
        this.numericPolicy = builder.numericPolicy;
        this.importModule = builder.importModule;
        this.exportSignalGlobals = builder.exportSignalGlobals;
    }

    public NumericPolicy getNumericPolicy() {
        return numericPolicy;
    }

    /**
     * Get the module name the host callbacks are imported from.
     *
     * @return The module name, {@code dom} by default.
     */
    public String getImportModule() {
        return importModule;
    }

    /**
     * Get whether the global of every signal is exported as {@code signal_<id>}.
     *
     * @return Whether globals are exported, true by default.
     */
    public boolean isExportSignalGlobals() {
        return exportSignalGlobals;
    }

    public Builder toBuilder() {
        return new Builder()
                .numericPolicy(numericPolicy)
                .importModule(importModule)
                .exportSignalGlobals(exportSignalGlobals);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CompilerOptions{numericPolicy=" + numericPolicy
                + ", importModule=" + importModule
                + ", exportSignalGlobals=" + exportSignalGlobals + "}";
    }

    public static final class Builder {
        private NumericPolicy numericPolicy = NumericPolicy.EXACT;
        private String importModule = "dom";
        private boolean exportSignalGlobals = true;

        private Builder() {
        }

        public Builder numericPolicy(@NotNull NumericPolicy numericPolicy) {
            this.numericPolicy = Objects.requireNonNull(numericPolicy);
            return this;
        }

        public Builder importModule(@NotNull String importModule) {
            this.importModule = Objects.requireNonNull(importModule);
            return this;
        }

        public Builder exportSignalGlobals(boolean exportSignalGlobals) {
            this.exportSignalGlobals = exportSignalGlobals;
            return this;
        }

        public CompilerOptions build() {
            return new CompilerOptions(this);
        }
    }
}
