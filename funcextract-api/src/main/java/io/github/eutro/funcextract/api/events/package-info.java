/**
 * Events that occur during an extraction.
 * <p>
 * These can be used to skip regions, to collect or write reports, and to route diagnostics.
 * <p>
 * The API revolves around {@link io.github.eutro.funcextract.api.events.EventSupplier}s,
 * which dispatch events of a specific type to the listeners of their exact class.
 */
package io.github.eutro.funcextract.api.events;
