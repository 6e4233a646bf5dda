package io.b2mash.propertysync.workflow;

import java.util.Set;

/**
 * One node of the form workflow.
 *
 * @param step the form
 * @param title heading shown for the form
 * @param path route of the form page
 * @param description one-line summary of what the form manages
 * @param dependencies steps that must hold at least one record before this one is accessible
 */
public record WorkflowStepDescriptor(
    WorkflowStep step,
    String title,
    String path,
    String description,
    Set<WorkflowStep> dependencies) {

  public WorkflowStepDescriptor {
    dependencies = Set.copyOf(dependencies);
  }

  public String id() {
    return step.getId();
  }
}
