package com.anchorinsights.metrics.store;

import com.anchorinsights.metrics.model.Anchor;
import com.anchorinsights.metrics.model.Asset;
import com.anchorinsights.metrics.repository.AnchorRepository;
import com.anchorinsights.metrics.repository.AssetRepository;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.UUID;

@Component
public class R2dbcAnchorMetadataStore implements AnchorMetadataStore {

    private final AnchorRepository anchorRepository;
    private final AssetRepository assetRepository;

    public R2dbcAnchorMetadataStore(AnchorRepository anchorRepository, AssetRepository assetRepository) {
        this.anchorRepository = anchorRepository;
        this.assetRepository  = assetRepository;
    }

    @Override
    public Flux<Anchor> listAnchors(long limit, long offset) {
        return anchorRepository.findPage(limit, offset);
    }

    @Override
    public Flux<Asset> getAssetsByAnchor(UUID anchorId) {
        return assetRepository.findByAnchorId(anchorId.toString());
    }
}
