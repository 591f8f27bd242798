/**
 * Reusable pieces of configuration for a {@link io.github.eutro.funcextract.api.RegionExtractor},
 * built on the {@link io.github.eutro.funcextract.api.events events API}.
 */
package io.github.eutro.funcextract.api.bits;
