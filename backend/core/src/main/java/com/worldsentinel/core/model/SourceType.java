package com.worldsentinel.core.model;

public enum SourceType {
    WIRE,
    GOV,
    INTEL,
    MAINSTREAM,
    MARKET,
    TECH
}
