package com.verlumen.maintenance.simulation;

/**
 * One period of a simulated trajectory.
 *
 * @param period zero-based period index
 * @param state state observed at the start of the period
 * @param outcome what happened during the period
 * @param cost cost charged during the period
 */
public record TrajectoryStep(int period, int state, StepOutcome outcome, double cost) {}
