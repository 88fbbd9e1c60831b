/**
 * Events that occur during a compilation.
 * <p>
 * These can be used to configure the compiler, to inspect intermediate results, and to collect outputs.
 * <p>
 * The API revolves around {@link io.github.sigwasm.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.sigwasm.api.events;
