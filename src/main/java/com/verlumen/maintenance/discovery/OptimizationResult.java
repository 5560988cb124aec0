package com.verlumen.maintenance.discovery;

import com.verlumen.maintenance.model.Policy;

/**
 * Outcome of a genetic search.
 *
 * @param bestPolicy the cheapest policy in the final population
 * @param bestCost its estimated average cost per period
 * @param trace best cost per generation
 */
public record OptimizationResult(Policy bestPolicy, double bestCost, OptimizationTrace trace) {}
