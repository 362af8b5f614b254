package com.whaleradar.api.dto;

import java.util.List;

public record WatchlistResponse(List<String> watched, List<String> elevated) {
}
