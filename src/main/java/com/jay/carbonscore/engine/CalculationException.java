package com.jay.carbonscore.engine;

import com.jay.carbonscore.model.enums.CalculationStage;

/**
 * A footprint calculation aborted at {@link #getStage()}. No partial result exists.
 */
public class CalculationException extends RuntimeException {

    private final CalculationStage stage;

    public CalculationException(CalculationStage stage, Throwable cause) {
        super("Calculation failed at stage " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public CalculationStage getStage() {
        return stage;
    }
}
