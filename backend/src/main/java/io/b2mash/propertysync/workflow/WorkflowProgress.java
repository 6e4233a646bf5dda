package io.b2mash.propertysync.workflow;

/**
 * Position of a step in the workflow.
 *
 * @param currentStep 1-based position
 * @param totalSteps number of steps in the workflow
 * @param percentage {@code currentStep * 100 / totalSteps}
 */
public record WorkflowProgress(
    int currentStep, int totalSteps, int percentage, boolean isFirst, boolean isLast) {}
