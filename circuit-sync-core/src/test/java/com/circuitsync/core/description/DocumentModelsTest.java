package com.circuitsync.core.description;

import com.circuitsync.core.TestSymbols;
import com.circuitsync.core.config.SyncConfig.DocumentSettings;
import com.circuitsync.core.document.ProjectDocument;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.hierarchy.HierarchyManager;
import com.circuitsync.core.library.LibSymbolCodec;
import com.circuitsync.core.model.AnnotationKind;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Mirror;
import com.circuitsync.core.model.Net;
import com.circuitsync.core.model.NetClass;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.util.IdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentModels}.
 */
class DocumentModelsTest {

    private static final String R1 = IdGenerator.uuid("test", "R1");
    private static final String R2 = IdGenerator.uuid("test", "R2");

    private SchematicDocument root;
    private ProjectDocument project;

    @BeforeEach
    void setUp() {
        root = SchematicDocument.create("amp.kicad_sch", 20231120, "test", IdGenerator.uuid("test", "root"), "A4", true);
        root.embedLibSymbol(LibSymbolCodec.synthesize("Device:R", TestSymbols.twoPinPassive(), Map.of("Reference", "R")));
        project = new ProjectDocument(Path.of("."), "amp", root);
        placeResistor(root, R1, "R1", "100", "50");
        placeResistor(root, R2, "R2", "120", "50");
    }

    @Test
    void fromDocument_placedSymbols_becomeComponents() {
        BuildResult result = DocumentModels.fromDocument(project);

        assertThat(result.issues()).isEmpty();
        assertThat(result.circuit().components()).extracting(Component::reference).containsExactly("R1", "R2");
        Component r1 = result.circuit().component(R1).orElseThrow();
        assertThat(r1.identity()).isEqualTo(R1);
        assertThat(r1.properties()).containsEntry("Value", "10k").doesNotContainKey("Reference");
        assertThat(r1.pins()).hasSize(2);
        assertThat(r1.position().samePoint(Position.at("100", "50"))).isTrue();
    }

    @Test
    void fromDocument_labelsAtPins_formNets() {
        // Given: R1 pin 2 sits at (100, 53.81), R2 pin 1 at (120, 46.19)
        label(AnnotationKind.LOCAL_LABEL, "MID", "100", "53.81");
        label(AnnotationKind.LOCAL_LABEL, "MID", "120.3", "46.19");
        label(AnnotationKind.GLOBAL_LABEL, "GND", "120", "53.81");
        label(AnnotationKind.LOCAL_LABEL, "FLOATING", "200", "200");

        // When
        Circuit circuit = DocumentModels.fromDocument(project).circuit();

        // Then
        assertThat(circuit.nets()).extracting(Net::name).containsExactly("MID", "GND");
        assertThat(circuit.net("MID").orElseThrow().endpoints())
            .containsExactlyInAnyOrder(Endpoint.pin(R1, "2"), Endpoint.pin(R2, "1"));
        assertThat(circuit.net("GND").orElseThrow().netClass()).isEqualTo(NetClass.POWER);
        assertThat(circuit.annotations()).hasSize(4);
    }

    @Test
    void fromDocument_labelBeyondTolerance_doesNotConnect() {
        label(AnnotationKind.LOCAL_LABEL, "NEAR", "100", "54.5");

        assertThat(DocumentModels.fromDocument(project).circuit().nets()).isEmpty();
    }

    @Test
    void fromDocument_implicitLabelName_isNotExplicit() {
        label(AnnotationKind.LOCAL_LABEL, "Net-(R1-Pad2)", "100", "53.81");
        label(AnnotationKind.LOCAL_LABEL, "Net-(R1-Pad2)", "120", "46.19");

        Net net = DocumentModels.fromDocument(project).circuit().nets().get(0);

        assertThat(net.explicitName()).isFalse();
    }

    @Test
    void fromDocument_missingEmbeddedSymbol_reportsUnresolvedReference() {
        root.add(SchematicElements.symbol("Device:C", new Position(new BigDecimal("150"), new BigDecimal("50"), 0,
            Mirror.NONE), IdGenerator.uuid("test", "C1"), "C1", Map.of(), List.of(), "amp", "/"));

        BuildResult result = DocumentModels.fromDocument(project);

        assertThat(result.issues()).extracting(SyncIssue::kind).containsExactly(IssueKind.UNRESOLVED_REFERENCE);
        assertThat(result.circuit().components()).hasSize(3);
    }

    @Test
    void fromDocument_sheetWithHierarchicalLabels_becomesInstanceWithPorts() {
        // Given
        String identity = IdGenerator.uuid("/", "sheet", "filter");
        SubcircuitInstance instance = new SubcircuitInstance(identity, identity, "filter1", "filter", Map.of(),
            List.of("IN"), null, null, null);
        SchematicDocument child = new HierarchyManager(DocumentSettings.defaults())
            .add(project, root, instance, Position.at("50", "100"), "/");
        child.embedLibSymbol(LibSymbolCodec.synthesize("Device:R", TestSymbols.twoPinPassive(), Map.of()));
        String inner = IdGenerator.uuid("test", "inner");
        placeResistor(child, inner, "R3", "100", "50");
        child.add(SchematicElements.label(AnnotationKind.HIERARCHICAL_LABEL, "IN", Position.at("100", "46.19"),
            IdGenerator.uuid("test", "hl")));
        label(AnnotationKind.LOCAL_LABEL, "VIN", "100", "46.19");
        label(AnnotationKind.LOCAL_LABEL, "VIN", "50", "102.54");

        // When
        Circuit circuit = DocumentModels.fromDocument(project).circuit();

        // Then
        SubcircuitInstance read = circuit.instances().get(0);
        assertThat(read.key()).isEqualTo(identity);
        assertThat(read.name()).isEqualTo("filter1");
        assertThat(read.ports()).containsExactly("IN");
        assertThat(read.fileName()).isEqualTo(HierarchyManager.fragmentFileName(identity));
        assertThat(read.body().ports()).extracting(p -> p.name()).containsExactly("IN");
        assertThat(read.body().net("IN").orElseThrow().endpoints()).containsExactly(Endpoint.pin(inner, "1"));
        assertThat(circuit.net("VIN").orElseThrow().endpoints())
            .containsExactlyInAnyOrder(Endpoint.pin(R1, "1"), Endpoint.port(identity, "IN"));
    }

    @Test
    void embeddedLibrary_collectsSymbolsOfAllFragments() {
        assertThat(DocumentModels.embeddedLibrary(project).resolve("Device:R"))
            .hasValueSatisfying(definition -> assertThat(definition.pins()).hasSize(2));
    }

    private void placeResistor(SchematicDocument fragment, String uuid, String reference, String x, String y) {
        fragment.add(SchematicElements.symbol("Device:R", Position.at(x, y), uuid, reference,
            Map.of("Value", "10k"), List.of("1", "2"), "amp", "/"));
    }

    private void label(AnnotationKind kind, String text, String x, String y) {
        root.add(SchematicElements.label(kind, text, Position.at(x, y), IdGenerator.uuid("test", text, x, y)));
    }
}
