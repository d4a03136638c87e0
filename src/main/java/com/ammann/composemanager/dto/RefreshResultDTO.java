/* (C)2026 */
package com.ammann.composemanager.dto;

import java.time.Instant;

/**
 * Result of a manual compose file rescan.
 *
 * @param filesDiscovered the number of compose files found
 * @param message         a human-readable summary
 * @param timestamp       when the rescan finished
 */
public record RefreshResultDTO(int filesDiscovered, String message, Instant timestamp) {}
