package dev.py2flow.engine;

import dev.py2flow.SampleFlows;
import dev.py2flow.model.Dataset;
import dev.py2flow.model.DatasetRole;
import dev.py2flow.model.Flow;
import dev.py2flow.model.Recipe;
import dev.py2flow.model.RecipeKind;
import dev.py2flow.model.ValidationIssue;
import dev.py2flow.model.ValidationIssue.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlowValidatorTest {

    @Test
    void soundFlowHasNoIssues() {
        assertThat(FlowValidator.validate(SampleFlows.customerRevenue())).isEmpty();
    }

    @Test
    void reportsCycle() {
        List<ValidationIssue> issues = FlowValidator.validate(SampleFlows.cyclic());

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo("CYCLE_DETECTED");
            assertThat(issue.severity()).isEqualTo(Severity.ERROR);
            assertThat(issue.subject()).isEqualTo("a");
        });
    }

    @Test
    void reportsRoleViolations() {
        var flow = new Flow("roles");
        flow.addDataset(Dataset.of("src", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("derived", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("unused", DatasetRole.INTERMEDIATE));
        flow.addRecipe(new Recipe("sync_derived", RecipeKind.SYNC, List.of("src"), List.of("derived"), null, null,
            null));
        flow.addRecipe(new Recipe("sort_unused", RecipeKind.SORT, List.of("derived"), List.of("unused"), null, null,
            null));

        List<ValidationIssue> issues = FlowValidator.validate(flow);

        assertThat(issues).extracting(ValidationIssue::code).containsOnly("ROLE_VIOLATION");
        assertThat(issues).extracting(ValidationIssue::subject).containsExactly("derived", "unused");
        assertThat(issues).allMatch(ValidationIssue::isError);
    }

    @Test
    void warnsAboutPythonFallbackAndDisconnectedParts() {
        var flow = new Flow("mixed");
        flow.addDataset(Dataset.of("a", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("b", DatasetRole.OUTPUT));
        flow.addDataset(Dataset.of("c", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("d", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("python_b", RecipeKind.CUSTOM_CODE, List.of("a"), List.of("b"), null, "b = f(a)",
            null));
        flow.addRecipe(new Recipe("sort_d", RecipeKind.SORT, List.of("c"), List.of("d"), null, null, null));

        List<ValidationIssue> issues = FlowValidator.validate(flow);

        assertThat(issues).extracting(ValidationIssue::code).containsExactly("PYTHON_FALLBACK", "DISCONNECTED_FLOW");
        assertThat(issues).noneMatch(ValidationIssue::isError);
    }

    @Test
    void reportsRecipeSharingDatasetName() {
        var flow = new Flow("names");
        flow.addDataset(Dataset.of("src", DatasetRole.INPUT));
        flow.addDataset(Dataset.of("out", DatasetRole.OUTPUT));
        flow.addRecipe(new Recipe("src", RecipeKind.SORT, List.of("src"), List.of("out"), null, null, null));

        assertThat(FlowValidator.validate(flow)).extracting(ValidationIssue::code).containsExactly("DUPLICATE_NAME");
    }
}
