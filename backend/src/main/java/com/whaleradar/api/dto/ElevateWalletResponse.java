package com.whaleradar.api.dto;

/**
 * @param created false when the address was already elevated
 */
public record ElevateWalletResponse(String address, boolean created) {
}
