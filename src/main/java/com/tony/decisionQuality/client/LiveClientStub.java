package com.tony.decisionQuality.client;

import com.tony.decisionQuality.exception.LiveIoDisabledException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Emplacement du futur client live. Échoue immédiatement sur tout fetch : aucune E/S réelle.
 */
public class LiveClientStub implements LiveSourceClient {

    private static final String MESSAGE =
            "Live IO is disabled; stub connector never fetches. Set LIVE_IO_ALLOWED=true to attempt live (stub still raises).";

    @Override
    public String getName() {
        return "live_connector_stub";
    }

    @Override
    public boolean isRecorded() {
        return false;
    }

    @Override
    public List<Map<String, Object>> fetchFixtures() {
        throw new LiveIoDisabledException(MESSAGE);
    }

    @Override
    public Optional<Map<String, Object>> fetchFixtureDetail(String fixtureId) {
        throw new LiveIoDisabledException(MESSAGE);
    }
}
