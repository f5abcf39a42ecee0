package com.anchorinsights.metrics.repository;

import com.anchorinsights.metrics.model.Anchor;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AnchorRepository extends ReactiveCrudRepository<Anchor, String> {

    /**
     * One page of anchors, most reliable first. Validation of {@code limit}/{@code offset}
     * is left to the database.
     */
    @Query("""
        SELECT * FROM anchors
        ORDER BY reliability_score DESC, name ASC
        LIMIT :limit OFFSET :offset
        """)
    Flux<Anchor> findPage(long limit, long offset);
}
