package com.reviewtrack.track;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TrackProperties.class)
public class TrackConfig {
}
