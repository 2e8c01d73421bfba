package com.circuitsync.core.sync;

import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.SyncIssue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ReportWriter}.
 */
class ReportWriterTest {

    @Test
    void toJson_successfulRun_writesFieldsInReportOrder() throws Exception {
        // Given
        SyncReport report = new SyncReport(true, false,
            new SyncReport.ChangeCounts(2, 0, 1, 3),
            new SyncReport.ChangeCounts(1, 1, 0, 0),
            null,
            List.of("amp.kicad_sch"), List.of(),
            List.of(SyncIssue.of(IssueKind.PLACEMENT_EXHAUSTED, "R9", "No free slot")));

        // When
        String json = ReportWriter.toJson(report);

        // Then
        JsonNode tree = new ObjectMapper().readTree(json);
        assertThat(tree.fieldNames()).toIterable().containsExactly("success", "dryRun", "components", "nets",
            "instances", "fragmentsWritten", "fragmentsDeleted", "issues");
        assertThat(tree.get("components").get("updated").asInt()).isEqualTo(1);
        assertThat(tree.get("instances").get("kept").asInt()).isZero();
        assertThat(tree.get("fragmentsWritten").get(0).asText()).isEqualTo("amp.kicad_sch");
        JsonNode issue = tree.get("issues").get(0);
        assertThat(issue.get("kind").asText()).isEqualTo("PLACEMENT_EXHAUSTED");
        assertThat(issue.get("severity").asText()).isEqualTo("WARNING");
        assertThat(issue.has("fatal")).isFalse();
    }

    @Test
    void toJson_failedRun_reportsZeroCounts() throws Exception {
        SyncReport report = SyncReport.failed(true,
            List.of(SyncIssue.of(IssueKind.IDENTITY_CONFLICT, "R1", "Duplicate reference R1")));

        JsonNode tree = new ObjectMapper().readTree(ReportWriter.toJson(report));

        assertThat(tree.get("success").asBoolean()).isFalse();
        assertThat(tree.get("dryRun").asBoolean()).isTrue();
        assertThat(tree.get("nets").get("added").asInt()).isZero();
        assertThat(tree.get("issues").get(0).get("entity").asText()).isEqualTo("R1");
    }

    @Test
    void toJson_indentsOutput() {
        String json = ReportWriter.toJson(SyncReport.failed(false, List.of()));

        assertThat(json).contains(System.lineSeparator()).startsWith("{");
    }
}
