package com.claimlens.recalibration.engine;

import com.claimlens.recalibration.model.OptimizationMethod;
import com.claimlens.recalibration.model.OptimizationResult;

/**
 * One weight search strategy. Implementations read everything from the context and never
 * return a weight outside its factor's bounds.
 */
public interface OptimizationStrategy {

    OptimizationMethod method();

    OptimizationResult optimize(OptimizationContext context);
}
