package tech.yump.boundary.tenant;

/**
 * Progress of a single enforcement run.
 */
public enum EnforcementStage {
    NO_CONTEXT,
    CANDIDATES_GATHERED,
    RECONCILED,
    VALIDATED,
    REJECTED
}
