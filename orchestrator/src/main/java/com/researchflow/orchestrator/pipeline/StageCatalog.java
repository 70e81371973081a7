package com.researchflow.orchestrator.pipeline;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.model.FailurePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The closed set of stages this orchestrator can run, built once from
 * {@code researchflow.stages} at startup.
 *
 * Construction fails with {@link IllegalStateException} (and so does the
 * application) when the catalog is inconsistent:
 * <ul>
 *   <li>a stage without steps</li>
 *   <li>two steps of one stage sharing a name</li>
 *   <li>a LIVE policy other than strict</li>
 * </ul>
 * Task type resolution is checked separately by {@code AgentRegistry}.
 */
@Component
public class StageCatalog {

    private static final Logger log = LoggerFactory.getLogger(StageCatalog.class);

    private final Map<Integer, StageDefinition> stages;

    @Autowired
    public StageCatalog(ResearchFlowProperties properties) {
        this(fromProperties(properties.getStages()));
    }

    public StageCatalog(Collection<StageDefinition> definitions) {
        Map<Integer, StageDefinition> byId = new TreeMap<>();
        for (StageDefinition stage : definitions) {
            validate(stage);
            if (byId.put(stage.id(), stage) != null) {
                throw new IllegalStateException("Stage " + stage.id() + " is defined twice");
            }
            log.info("Registered stage {} '{}' with {} steps", stage.id(), stage.name(), stage.steps().size());
        }
        this.stages = Map.copyOf(byId);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<StageDefinition> find(int stageId) {
        return Optional.ofNullable(stages.get(stageId));
    }

    public StageDefinition get(int stageId) {
        return find(stageId).orElseThrow(() ->
                new IllegalArgumentException("Unknown stage: " + stageId));
    }

    /** Every task type referenced by any step of any stage. */
    public Set<String> referencedTaskTypes() {
        Set<String> types = new LinkedHashSet<>();
        stages.values().forEach(s -> s.steps().forEach(step -> types.add(step.taskType())));
        return types;
    }

    public List<Integer> stageIds() {
        return stages.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Construction helpers
    // ------------------------------------------------------------------

    private static List<StageDefinition> fromProperties(Map<Integer, ResearchFlowProperties.Stage> config) {
        List<StageDefinition> result = new ArrayList<>();
        config.forEach((id, stage) -> {
            List<StepDefinition> steps = new ArrayList<>();
            for (ResearchFlowProperties.StepSpec spec : stage.getSteps()) {
                if (spec.getLive() != FailurePolicy.STRICT) {
                    throw new IllegalStateException("Stage " + id + " step '" + spec.getName()
                            + "': LIVE policy must be strict, got " + spec.getLive());
                }
                steps.add(new StepDefinition(spec.getName(), steps.size(), spec.getTaskType(), spec.getDemo()));
            }
            List<StageDefinition.RequiredField> fields = stage.getRequiredFields().stream()
                    .map(f -> new StageDefinition.RequiredField(f.getName(), f.getMinLength()))
                    .toList();
            result.add(new StageDefinition(id, stage.getName(), steps, fields));
        });
        return result;
    }

    private static void validate(StageDefinition stage) {
        if (stage.steps().isEmpty()) {
            throw new IllegalStateException("Stage " + stage.id() + " has no steps");
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < stage.steps().size(); i++) {
            StepDefinition step = stage.steps().get(i);
            if (!names.add(step.name())) {
                throw new IllegalStateException(
                        "Stage " + stage.id() + " declares step '" + step.name() + "' more than once");
            }
            if (step.order() != i) {
                throw new IllegalStateException(
                        "Stage " + stage.id() + " step '" + step.name() + "' is out of order");
            }
        }
    }
}
