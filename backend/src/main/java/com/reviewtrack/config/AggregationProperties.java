package com.reviewtrack.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reviewtrack.aggregation")
@NoArgsConstructor
@Getter
@Setter
public class AggregationProperties {

    /** Number of tracks aggregated concurrently. Default 4. */
    private int parallelism = 4;
}
