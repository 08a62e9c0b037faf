package com.skillgate.agent.tier;

/**
 * Model and thinking level forced onto sub-agent sessions spawned for a
 * user. A null field leaves normal resolution in place.
 */
public record DelegationOverride(String model, String thinking) {
}
