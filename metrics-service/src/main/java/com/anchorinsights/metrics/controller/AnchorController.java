package com.anchorinsights.metrics.controller;

import com.anchorinsights.metrics.dto.AnchorsResponse;
import com.anchorinsights.metrics.service.AnchorMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/anchors")
public class AnchorController {

    private static final Logger log = LoggerFactory.getLogger(AnchorController.class);

    private final AnchorMetricsService anchorMetricsService;

    public AnchorController(AnchorMetricsService anchorMetricsService) {
        this.anchorMetricsService = anchorMetricsService;
    }

    @GetMapping
    public Mono<ResponseEntity<AnchorsResponse>> listAnchors(
            @RequestParam(defaultValue = "50") long limit,
            @RequestParam(defaultValue = "0") long offset) {
        log.info("Anchor list query received. limit={} offset={}", limit, offset);
        return anchorMetricsService.getAnchors(limit, offset)
            .map(ResponseEntity::ok);
    }
}
