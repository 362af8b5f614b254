package com.whaleradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Idempotency record for an emitted finding or cluster. Append-only: never updated or deleted.
 */
@Document(collection = "seen_digests")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SeenDigest {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Instant createdAt;
}
