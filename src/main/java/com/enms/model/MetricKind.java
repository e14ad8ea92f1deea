package com.enms.model;

/**
 * Origin of a performance metric row. Drift checks only look at EVALUATION rows;
 * trial rows are the per-arm summaries written when an A/B test is decided.
 */
public enum MetricKind {
    EVALUATION,
    TRIAL_INCUMBENT,
    TRIAL_CHALLENGER
}
