package io.github.hatchcrm.aiemployees.protocol.api;

/** Body of an approve or reject call; {@code note} doubles as the rejection reason. */
public record ReviewActionRequest(String note) {}
