package com.whaleradar.api.dto;

import com.whaleradar.api.validation.WalletAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * POST /api/v1/watchlist/elevated request body. Reason is optional.
 */
public record ElevateWalletRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @WalletAddress
        String address,

        @Size(max = 200)
        String reason
) {
}
