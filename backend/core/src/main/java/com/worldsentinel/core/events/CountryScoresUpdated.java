package com.worldsentinel.core.events;

import com.worldsentinel.core.model.CountryScore;

import java.time.Instant;
import java.util.List;

public record CountryScoresUpdated(Instant timestamp, List<CountryScore> scores, boolean learning) implements Event {
    @Override
    public String type() {
        return "CountryScoresUpdated";
    }
}
