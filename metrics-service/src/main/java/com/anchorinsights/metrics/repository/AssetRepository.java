package com.anchorinsights.metrics.repository;

import com.anchorinsights.metrics.model.Asset;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AssetRepository extends ReactiveCrudRepository<Asset, String> {

    Flux<Asset> findByAnchorId(String anchorId);
}
