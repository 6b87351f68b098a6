package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.capability.input.AgentInput;
import com.agentorchestra.orchestrator.capability.input.ArchitectureInput;
import com.agentorchestra.orchestrator.capability.input.PlanningInput;
import com.agentorchestra.orchestrator.capability.input.RepositoryAnalysisInput;
import com.agentorchestra.orchestrator.capability.input.RequirementsInput;
import com.agentorchestra.orchestrator.capability.input.ValidationInput;
import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.Stage;
import com.agentorchestra.orchestrator.model.WorkflowRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input construction rules for pipeline stages.
 *
 * <pre>
 *   repository_analysis      path = repository_path or "."
 *   requirements_extraction  description = requirements or the shape's default,
 *                            context = {repository_analysis: &lt;repo output&gt;}
 *   architecture_design      requirements = requirements_extraction.requirements,
 *                            constraints = {repository_structure: repository_analysis.structure}
 *   implementation_planning  architecture = architecture_design.architecture,
 *                            requirements = requirements_extraction.requirements
 *   validation               implementation = implementation_planning.plan,
 *                            requirements = requirements_extraction.requirements
 * </pre>
 *
 * Every field read from a prior output goes through {@link AgentOutput#section}:
 * a missing field becomes {} and the stage still runs.
 */
final class StageInputs {

    private static final AgentOutput NONE = AgentOutput.of(Map.of());

    private StageInputs() {}

    static AgentInput forStage(Stage stage, WorkflowRequest request, Map<Stage, AgentOutput> prior) {
        return switch (stage) {
            case REPOSITORY_ANALYSIS -> new RepositoryAnalysisInput(
                    request.repositoryPath() != null ? request.repositoryPath() : ".",
                    List.of());
            case REQUIREMENTS_EXTRACTION -> {
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("repository_analysis", output(prior, Stage.REPOSITORY_ANALYSIS).fields());
                yield new RequirementsInput(projectDescription(request), context);
            }
            case ARCHITECTURE_DESIGN -> {
                Map<String, Object> constraints = new LinkedHashMap<>();
                constraints.put("repository_structure",
                        output(prior, Stage.REPOSITORY_ANALYSIS).section("structure"));
                yield new ArchitectureInput(
                        output(prior, Stage.REQUIREMENTS_EXTRACTION).section("requirements"),
                        constraints);
            }
            case IMPLEMENTATION_PLANNING -> new PlanningInput(
                    output(prior, Stage.ARCHITECTURE_DESIGN).section("architecture"),
                    output(prior, Stage.REQUIREMENTS_EXTRACTION).section("requirements"));
            case VALIDATION -> new ValidationInput(
                    output(prior, Stage.IMPLEMENTATION_PLANNING).section("plan"),
                    output(prior, Stage.REQUIREMENTS_EXTRACTION).section("requirements"));
        };
    }

    private static String projectDescription(WorkflowRequest request) {
        String requirements = request.requirements();
        return requirements == null || requirements.isEmpty()
                ? request.workflowType().defaultRequirements()
                : requirements;
    }

    private static AgentOutput output(Map<Stage, AgentOutput> prior, Stage stage) {
        return prior.getOrDefault(stage, NONE);
    }
}
