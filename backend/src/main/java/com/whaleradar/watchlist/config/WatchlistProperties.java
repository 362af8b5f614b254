package com.whaleradar.watchlist.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Seed address lists. Every elevated seed is watched too; the sets grow at runtime through promotion.
 */
@ConfigurationProperties(prefix = "whaleradar.watchlist")
@NoArgsConstructor
@Getter
@Setter
public class WatchlistProperties {

    private List<String> watchAddresses = new ArrayList<>();

    private List<String> elevatedAddresses = new ArrayList<>();
}
