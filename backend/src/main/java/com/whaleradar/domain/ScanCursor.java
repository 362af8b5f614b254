package com.whaleradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Resume cursor per source (one source per watched address): history below lastMs has already been fetched.
 */
@Document(collection = "scan_cursors")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ScanCursor {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long lastMs;
    private Instant updatedAt;
}
