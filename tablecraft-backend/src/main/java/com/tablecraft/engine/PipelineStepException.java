package com.tablecraft.engine;

/**
 * Thrown when one step of a pipeline fails. The cause keeps the original error category.
 */
public class PipelineStepException extends RuntimeException {
    private final int step;
    private final String transformationType;

    /**
     * Create a new exception.
     *
     * @param step 1-based step number
     * @param transformationType transformation type of the failing step
     * @param cause original failure
     */
    public PipelineStepException(int step, String transformationType, RuntimeException cause) {
        super("Transformation failed at step " + step + ": " + cause.getMessage(), cause);
        this.step = step;
        this.transformationType = transformationType;
    }

    public int getStep() {
        return step;
    }

    public String getTransformationType() {
        return transformationType;
    }
}
