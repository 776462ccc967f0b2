/**
 * External stores the sync pass pulls from.
 *
 * <p>Each store is an interface so the sync logic can be exercised against in-memory
 * fakes; {@code source.impl} holds the JSON/markdown file readers used at runtime.
 * A missing file is an empty source. A file that exists but cannot be parsed raises
 * {@code SourceUnavailableException}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.contextgraph.source;
