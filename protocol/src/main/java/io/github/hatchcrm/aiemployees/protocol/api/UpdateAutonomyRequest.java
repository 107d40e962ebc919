package io.github.hatchcrm.aiemployees.protocol.api;

public record UpdateAutonomyRequest(AutonomyMode autonomyMode) {}
