package com.scholary.talkingpet.api;

/**
 * Error body for every failed request.
 *
 * @param code stable machine-readable code, e.g. {@code job_timed_out}
 * @param fault {@code CALLER}, {@code PROVIDER} or {@code INTERNAL}
 * @param message human readable detail
 */
public record ErrorResponse(String code, String fault, String message) {}
