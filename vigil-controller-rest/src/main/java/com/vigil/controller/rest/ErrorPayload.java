package com.vigil.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** Structured error payload returned by REST endpoints. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(Instant timestamp, int status, String error, String code, String message, String path) {}
