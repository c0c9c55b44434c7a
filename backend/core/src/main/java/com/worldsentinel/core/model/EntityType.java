package com.worldsentinel.core.model;

public enum EntityType {
    COMPANY,
    INDEX,
    COMMODITY,
    CRYPTO,
    COUNTRY,
    ORGANIZATION,
    PERSON
}
