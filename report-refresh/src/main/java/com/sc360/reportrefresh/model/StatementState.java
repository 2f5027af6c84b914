package com.sc360.reportrefresh.model;

/**
 * Result of one describe call against the execution engine.
 */
public record StatementState(EngineStatus status, String error) {}
