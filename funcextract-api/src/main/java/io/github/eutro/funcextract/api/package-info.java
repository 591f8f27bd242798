/**
 * A configurable front end over the core region analysis.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.funcextract.api.RegionExtractor},
 * to which modules can be submitted for extraction.
 * <p>
 * The extractor can be configured using the {@link io.github.eutro.funcextract.api.events
 * events API}, and the {@link io.github.eutro.funcextract.api.bits bits} built on it.
 */
package io.github.eutro.funcextract.api;
