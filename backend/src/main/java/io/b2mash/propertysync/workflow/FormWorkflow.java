package io.b2mash.propertysync.workflow;

import io.b2mash.propertysync.exception.ResourceNotFoundException;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed sequence of the five forms and the data dependencies between them. Navigation follows
 * declaration order; access follows the dependency edges.
 */
@Component
public class FormWorkflow {

  private static final Logger log = LoggerFactory.getLogger(FormWorkflow.class);

  /** Route of the forms dashboard, used when there is no adjacent step. */
  public static final String FORMS_HOME = "/forms";

  static final List<WorkflowStepDescriptor> DEFAULT_STEPS =
      List.of(
          new WorkflowStepDescriptor(
              WorkflowStep.OPERATOR,
              "Operator Management",
              "/forms/operator",
              "Manage property operators and staff",
              Set.of()),
          new WorkflowStepDescriptor(
              WorkflowStep.BUILDING,
              "Building Configuration",
              "/forms/building",
              "Configure building details and amenities",
              Set.of(WorkflowStep.OPERATOR)),
          new WorkflowStepDescriptor(
              WorkflowStep.ROOM,
              "Room Setup",
              "/forms/room",
              "Set up rooms and their amenities",
              Set.of(WorkflowStep.BUILDING)),
          new WorkflowStepDescriptor(
              WorkflowStep.TENANT,
              "Tenant Management",
              "/forms/tenant",
              "Manage tenant information and assignments",
              Set.of(WorkflowStep.BUILDING, WorkflowStep.ROOM, WorkflowStep.OPERATOR)),
          new WorkflowStepDescriptor(
              WorkflowStep.LEAD,
              "Lead Tracking",
              "/forms/lead",
              "Track prospective tenants and interests",
              Set.of(WorkflowStep.ROOM)));

  private final List<WorkflowStepDescriptor> steps;
  private final Map<WorkflowStep, Integer> positions = new EnumMap<>(WorkflowStep.class);

  public FormWorkflow() {
    this(DEFAULT_STEPS);
  }

  FormWorkflow(List<WorkflowStepDescriptor> steps) {
    this.steps = List.copyOf(steps);
    for (int i = 0; i < this.steps.size(); i++) {
      if (positions.put(this.steps.get(i).step(), i) != null) {
        throw new IllegalStateException("Step declared twice: " + this.steps.get(i).id());
      }
    }
    checkDependencies();
    log.debug("Form workflow initialized with {} steps", this.steps.size());
  }

  public List<WorkflowStepDescriptor> steps() {
    return steps;
  }

  public WorkflowStepDescriptor step(WorkflowStep step) {
    Integer position = positions.get(step);
    if (position == null) {
      throw new ResourceNotFoundException("Workflow step", step.getId());
    }
    return steps.get(position);
  }

  /** Looks a step up by its route id, e.g. {@code "tenant"}. */
  public WorkflowStepDescriptor step(String id) {
    return steps.stream()
        .filter(descriptor -> descriptor.id().equals(id))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("Workflow step", id));
  }

  public Optional<WorkflowStepDescriptor> previous(WorkflowStep current) {
    Integer position = positions.get(current);
    if (position == null || position == 0) {
      return Optional.empty();
    }
    return Optional.of(steps.get(position - 1));
  }

  public Optional<WorkflowStepDescriptor> next(WorkflowStep current) {
    Integer position = positions.get(current);
    if (position == null || position >= steps.size() - 1) {
      return Optional.empty();
    }
    return Optional.of(steps.get(position + 1));
  }

  public String backNavigationPath(WorkflowStep current) {
    return previous(current).map(WorkflowStepDescriptor::path).orElse(FORMS_HOME);
  }

  public String forwardNavigationPath(WorkflowStep current) {
    return next(current).map(WorkflowStepDescriptor::path).orElse(FORMS_HOME);
  }

  /**
   * A step is accessible when every step it depends on has at least one record in {@code
   * availableData}. Steps without dependencies are always accessible; a null snapshot counts as no
   * data at all.
   */
  public boolean isAccessible(
      WorkflowStep step, Map<WorkflowStep, ? extends Collection<?>> availableData) {
    Map<WorkflowStep, ? extends Collection<?>> snapshot =
        availableData == null ? Map.of() : availableData;
    return step(step).dependencies().stream()
        .allMatch(
            dependency -> {
              Collection<?> records = snapshot.get(dependency);
              return records != null && !records.isEmpty();
            });
  }

  public List<WorkflowStepDescriptor> accessibleSteps(
      Map<WorkflowStep, ? extends Collection<?>> availableData) {
    return steps.stream()
        .filter(descriptor -> isAccessible(descriptor.step(), availableData))
        .toList();
  }

  public WorkflowProgress progress(WorkflowStep current) {
    int position = positions.getOrDefault(current, -1) + 1;
    if (position == 0) {
      throw new ResourceNotFoundException("Workflow step", current.getId());
    }
    int total = steps.size();
    return new WorkflowProgress(
        position, total, (position * 100) / total, position == 1, position == total);
  }

  private void checkDependencies() {
    var visited = EnumSet.noneOf(WorkflowStep.class);
    var inProgress = EnumSet.noneOf(WorkflowStep.class);
    for (WorkflowStepDescriptor descriptor : steps) {
      for (WorkflowStep dependency : descriptor.dependencies()) {
        if (!positions.containsKey(dependency)) {
          throw new IllegalStateException(
              "Step " + descriptor.id() + " depends on undeclared step " + dependency.getId());
        }
      }
    }
    for (WorkflowStepDescriptor descriptor : steps) {
      visit(descriptor.step(), visited, inProgress);
    }
  }

  private void visit(WorkflowStep step, Set<WorkflowStep> visited, Set<WorkflowStep> inProgress) {
    if (visited.contains(step)) {
      return;
    }
    if (!inProgress.add(step)) {
      throw new IllegalStateException("Workflow dependencies form a cycle at " + step.getId());
    }
    for (WorkflowStep dependency : steps.get(positions.get(step)).dependencies()) {
      visit(dependency, visited, inProgress);
    }
    inProgress.remove(step);
    visited.add(step);
  }
}
