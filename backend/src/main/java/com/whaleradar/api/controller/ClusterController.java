package com.whaleradar.api.controller;

import com.whaleradar.api.dto.ClusterResponse;
import com.whaleradar.ingestion.store.EventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/clusters?limit=N: most recently detected clusters, newest first.
 */
@RestController
@RequestMapping("/api/v1/clusters")
@RequiredArgsConstructor
public class ClusterController {

    static final int MAX_LIMIT = 100;

    private final EventStore eventStore;

    @GetMapping
    public List<ClusterResponse> recent(@RequestParam(defaultValue = "20") int limit) {
        int bounded = Math.min(MAX_LIMIT, Math.max(1, limit));
        return eventStore.recentClusters(bounded).stream()
                .map(ClusterResponse::from)
                .toList();
    }
}
