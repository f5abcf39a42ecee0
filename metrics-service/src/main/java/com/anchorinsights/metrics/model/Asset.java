package com.anchorinsights.metrics.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Asset issued by an anchor. Only counted (asset coverage).
 */
@Data
@NoArgsConstructor
@Table("assets")
public class Asset {

    @Id
    private String id;

    private String anchorId;

    private String assetCode;

    private String issuer;

    private LocalDateTime createdAt;
}
