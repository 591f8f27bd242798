package io.github.eutro.funcextract.api.bits;

import io.github.eutro.funcextract.api.RegionExtractor;

/**
 * A reusable piece of configuration, usually a set of event listeners.
 *
 * @param <Onto> What this configures, typically a {@link RegionExtractor}.
 * @param <Ret>  What configuring returns, for bits that expose some state.
 * @see RegionExtractor#add(Bit)
 */
public interface Bit<Onto, Ret> {
    Ret addTo(Onto ex);
}
