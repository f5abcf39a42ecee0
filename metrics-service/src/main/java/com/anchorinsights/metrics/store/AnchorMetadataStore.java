package com.anchorinsights.metrics.store;

import com.anchorinsights.metrics.model.Anchor;
import com.anchorinsights.metrics.model.Asset;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Read access to anchor metadata. Errors from the underlying store are propagated
 * untouched; callers decide how they surface.
 */
public interface AnchorMetadataStore {

    Flux<Anchor> listAnchors(long limit, long offset);

    Flux<Asset> getAssetsByAnchor(UUID anchorId);
}
