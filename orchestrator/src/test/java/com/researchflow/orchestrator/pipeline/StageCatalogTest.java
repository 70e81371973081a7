package com.researchflow.orchestrator.pipeline;

import com.researchflow.orchestrator.config.ResearchFlowProperties;
import com.researchflow.orchestrator.model.FailurePolicy;
import com.researchflow.orchestrator.model.GovernanceMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageCatalogTest {

    private static ResearchFlowProperties.StepSpec step(String name, String taskType, FailurePolicy demo) {
        ResearchFlowProperties.StepSpec spec = new ResearchFlowProperties.StepSpec();
        spec.setName(name);
        spec.setTaskType(taskType);
        spec.setDemo(demo);
        return spec;
    }

    private static ResearchFlowProperties propertiesWith(ResearchFlowProperties.StepSpec... steps) {
        ResearchFlowProperties.Stage stage = new ResearchFlowProperties.Stage();
        stage.setName("Literature Discovery");
        stage.setSteps(List.of(steps));
        ResearchFlowProperties.RequiredField question = new ResearchFlowProperties.RequiredField();
        question.setName("research_question");
        question.setMinLength(20);
        stage.setRequiredFields(List.of(question));

        ResearchFlowProperties props = new ResearchFlowProperties();
        props.getStages().put(2, stage);
        return props;
    }

    @Test
    void buildsStagesFromConfiguration() {
        StageCatalog catalog = new StageCatalog(propertiesWith(
                step("lit_retrieval", "LIT_RETRIEVAL", FailurePolicy.STRICT),
                step("lit_triage",    "LIT_TRIAGE",    FailurePolicy.BEST_EFFORT),
                step("screen",        "STAGE2_SCREEN", FailurePolicy.STRICT)));

        StageDefinition stage = catalog.get(2);

        assertThat(stage.steps()).extracting(StepDefinition::name)
                .containsExactly("lit_retrieval", "lit_triage", "screen");
        assertThat(stage.steps()).extracting(StepDefinition::order).containsExactly(0, 1, 2);
        assertThat(stage.requiredFields()).containsExactly(new StageDefinition.RequiredField("research_question", 20));
        assertThat(catalog.referencedTaskTypes()).containsExactly("LIT_RETRIEVAL", "LIT_TRIAGE", "STAGE2_SCREEN");
        assertThat(catalog.stageIds()).containsExactly(2);
    }

    @Test
    void policyTable_liveIsAlwaysStrict() {
        StageCatalog catalog = new StageCatalog(propertiesWith(
                step("lit_triage", "LIT_TRIAGE", FailurePolicy.BEST_EFFORT)));
        StepDefinition triage = catalog.get(2).steps().get(0);

        assertThat(triage.policyFor(GovernanceMode.DEMO)).isEqualTo(FailurePolicy.BEST_EFFORT);
        assertThat(triage.policyFor(GovernanceMode.LIVE)).isEqualTo(FailurePolicy.STRICT);
    }

    @Test
    void liveBestEffort_failsStartup() {
        ResearchFlowProperties.StepSpec lenient = step("lit_triage", "LIT_TRIAGE", FailurePolicy.BEST_EFFORT);
        lenient.setLive(FailurePolicy.BEST_EFFORT);

        assertThatThrownBy(() -> new StageCatalog(propertiesWith(lenient)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("LIVE policy must be strict");
    }

    @Test
    void duplicateStepNames_failStartup() {
        assertThatThrownBy(() -> new StageCatalog(propertiesWith(
                step("screen", "STAGE2_SCREEN", FailurePolicy.STRICT),
                step("screen", "STAGE_2_EXTRACT", FailurePolicy.STRICT))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    void stageWithoutSteps_failsStartup() {
        assertThatThrownBy(() -> new StageCatalog(List.of(new StageDefinition(3, "Empty", List.of(), List.of()))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no steps");
    }

    @Test
    void unknownStage_isReportedOnGet() {
        StageCatalog catalog = new StageCatalog(List.of());

        assertThat(catalog.find(7)).isEmpty();
        assertThatThrownBy(() -> catalog.get(7)).isInstanceOf(IllegalArgumentException.class);
    }
}
