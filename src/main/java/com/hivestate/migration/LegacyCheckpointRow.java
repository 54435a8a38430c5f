package com.hivestate.migration;

/**
 * Legacy checkpoint; {@code data} is the stored JSON text.
 */
public record LegacyCheckpointRow(String name, String timestamp, String data) {
}
