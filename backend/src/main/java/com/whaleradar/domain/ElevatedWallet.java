package com.whaleradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted elevated-watch entry. Id is the lower-case address; entries are never removed.
 */
@Document(collection = "elevated_wallets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ElevatedWallet {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String reason;
    private ElevationOrigin origin;
    private Instant addedAt;
}
