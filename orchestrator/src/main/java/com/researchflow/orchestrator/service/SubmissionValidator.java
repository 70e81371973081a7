package com.researchflow.orchestrator.service;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.model.GovernanceMode;
import com.researchflow.orchestrator.pipeline.StageCatalog;
import com.researchflow.orchestrator.pipeline.StageDefinition;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Input rules for a stage submission. Collects every violation before
 * failing; nothing is persisted for an invalid request.
 */
@Component
public class SubmissionValidator {

    /** A request that passed every rule, with the mode resolved. */
    public record ValidSubmission(StageDefinition stage, String workflowId, GovernanceMode mode,
                                  Map<String, Object> fields) {}

    private final StageCatalog   catalog;
    private final Pattern        workflowIdPattern;
    private final GovernanceMode defaultMode;

    @Autowired
    public SubmissionValidator(StageCatalog catalog, ResearchFlowProperties properties) {
        this(catalog, properties.getSubmission().getWorkflowIdPattern(),
                properties.getGovernance().getDefaultMode());
    }

    public SubmissionValidator(StageCatalog catalog, String workflowIdPattern, GovernanceMode defaultMode) {
        this.catalog           = catalog;
        this.workflowIdPattern = Pattern.compile(workflowIdPattern);
        this.defaultMode       = defaultMode;
    }

    /**
     * @throws ValidationException listing every violated rule
     */
    public ValidSubmission validate(int stageId, String workflowId, String mode, Map<String, Object> fields) {
        List<String> details = new ArrayList<>();
        Map<String, Object> safeFields = fields == null ? Map.of() : fields;

        Optional<StageDefinition> stage = catalog.find(stageId);
        if (stage.isEmpty()) {
            details.add("stage: unknown stage " + stageId + ", expected one of " + catalog.stageIds());
        }

        if (workflowId == null || workflowId.isBlank()) {
            details.add("workflow_id: is required");
        } else if (!workflowIdPattern.matcher(workflowId).matches()) {
            details.add("workflow_id: must match " + workflowIdPattern.pattern());
        }

        GovernanceMode resolvedMode = defaultMode;
        if (mode != null) {
            Optional<GovernanceMode> parsed = GovernanceMode.parse(mode);
            if (parsed.isEmpty()) {
                details.add("mode: must be DEMO or LIVE");
            } else {
                resolvedMode = parsed.get();
            }
        }

        stage.ifPresent(s -> {
            for (StageDefinition.RequiredField field : s.requiredFields()) {
                Object value = safeFields.get(field.name());
                if (value == null) {
                    details.add(field.name() + ": is required");
                } else if (!(value instanceof String text)) {
                    details.add(field.name() + ": must be a string");
                } else if (text.trim().length() < field.minLength()) {
                    details.add(field.name() + ": must be at least " + field.minLength() + " characters");
                }
            }
        });

        if (!details.isEmpty()) {
            throw new ValidationException(details);
        }
        return new ValidSubmission(stage.get(), workflowId, resolvedMode, new LinkedHashMap<>(safeFields));
    }
}
