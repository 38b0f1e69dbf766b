/**
 * Resilience primitives: time budgets, circuit breaking, loop bounding and resource caps,
 * combined by {@link dbgate.resilience.SafetyManager}.
 */
package dbgate.resilience;
