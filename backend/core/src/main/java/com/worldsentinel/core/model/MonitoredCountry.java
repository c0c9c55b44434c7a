package com.worldsentinel.core.model;

/**
 * @param floor minimum composite applied after the calculation, {@code null} for none
 */
public record MonitoredCountry(String code, String name, Integer floor) {
}
