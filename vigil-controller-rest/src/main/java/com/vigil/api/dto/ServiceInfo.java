package com.vigil.api.dto;

/** Body of {@code GET /}: what this service is and where its entry points live. */
public record ServiceInfo(String service, String version, String health, String methods, String detect) {}
