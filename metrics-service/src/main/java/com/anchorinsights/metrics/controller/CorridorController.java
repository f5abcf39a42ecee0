package com.anchorinsights.metrics.controller;

import com.anchorinsights.metrics.dto.CorridorListQuery;
import com.anchorinsights.metrics.dto.CorridorMetrics;
import com.anchorinsights.metrics.dto.SortBy;
import com.anchorinsights.metrics.filter.CorridorFilter;
import com.anchorinsights.metrics.service.CorridorMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/corridors")
public class CorridorController {

    private static final Logger log = LoggerFactory.getLogger(CorridorController.class);

    private final CorridorMetricsService corridorMetricsService;

    public CorridorController(CorridorMetricsService corridorMetricsService) {
        this.corridorMetricsService = corridorMetricsService;
    }

    @GetMapping
    public Mono<ResponseEntity<List<CorridorMetrics>>> listCorridors(
            @RequestParam(defaultValue = "50") long limit,
            @RequestParam(defaultValue = "0") long offset,
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @RequestParam(name = "success_rate_min", required = false) Double successRateMin,
            @RequestParam(name = "success_rate_max", required = false) Double successRateMax,
            @RequestParam(name = "volume_min", required = false) Double volumeMin,
            @RequestParam(name = "volume_max", required = false) Double volumeMax,
            @RequestParam(name = "asset_code", required = false) String assetCode,
            @RequestParam(name = "time_period", required = false) String timePeriod) {
        log.info("Corridor list query received. limit={} offset={} sortBy={}", limit, offset, sortBy);
        return Mono.fromSupplier(() -> new CorridorListQuery(
                limit,
                offset,
                SortBy.fromParam(sortBy),
                new CorridorFilter(successRateMin, successRateMax, volumeMin, volumeMax, assetCode, timePeriod)))
            .flatMap(corridorMetricsService::listCorridors)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{corridorKey}")
    public Mono<ResponseEntity<CorridorMetrics>> getCorridor(@PathVariable String corridorKey) {
        return corridorMetricsService.getCorridorDetail(corridorKey)
            .map(ResponseEntity::ok);
    }
}
