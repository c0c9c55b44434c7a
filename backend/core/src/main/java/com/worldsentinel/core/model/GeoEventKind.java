package com.worldsentinel.core.model;

public enum GeoEventKind {
    PROTEST,
    MILITARY_FLIGHT,
    MILITARY_VESSEL,
    EARTHQUAKE,
    OUTAGE
}
