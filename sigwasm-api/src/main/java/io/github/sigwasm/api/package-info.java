/**
 * A configurable API over the core compiler.
 * <p>
 * The main entrypoint to this API is the {@link io.github.sigwasm.api.SignalCompiler},
 * to which components can be submitted for compilation.
 * <p>
 * The compiler can be configured using the {@link io.github.sigwasm.api.events events API}.
 */
package io.github.sigwasm.api;
