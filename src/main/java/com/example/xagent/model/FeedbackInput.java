package com.example.xagent.model;

/**
 * Input for a refinement iteration: the gate's rejection reason plus the original
 * document content the requirements are re-extracted from.
 */
public record FeedbackInput(
        FeedbackReason reason,
        String originalContent
) {}
