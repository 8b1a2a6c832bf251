package com.example.xagent.model;

public enum PipelineStatus {
    APPROVED,
    REJECTED,
    ERROR
}
