package io.github.eutro.funcextract.api.events;

import io.github.eutro.funcextract.api.RegionExtractor;

/**
 * An event fired on a {@link RegionExtractor}.
 */
public interface ExtractorEvent {
}
