package com.circuitsync.core.sync;

import com.circuitsync.core.TestSymbols;
import com.circuitsync.core.config.SyncConfig;
import com.circuitsync.core.config.SyncConfig.DocumentSettings;
import com.circuitsync.core.config.SyncConfig.SyncSettings;
import com.circuitsync.core.description.CircuitDescription;
import com.circuitsync.core.description.CircuitDescription.ComponentSpec;
import com.circuitsync.core.description.CircuitDescription.SubcircuitSpec;
import com.circuitsync.core.description.DocumentModels;
import com.circuitsync.core.document.ProjectDocument;
import com.circuitsync.core.document.ProjectStore;
import com.circuitsync.core.document.SchematicDocument;
import com.circuitsync.core.document.SchematicElements;
import com.circuitsync.core.model.Circuit;
import com.circuitsync.core.model.Component;
import com.circuitsync.core.model.Endpoint;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SubcircuitInstance;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.sexpr.SExpressionWriter;
import com.circuitsync.core.sexpr.SNode.SList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SynchronizationEngine}.
 */
class SynchronizationEngineTest {

    private static final String ROOT_FILE = "amp.kicad_sch";

    @TempDir
    Path projectDir;

    private final SynchronizationEngine engine = engine(false);

    @Test
    void synchronize_freshProject_writesRootWithComponentsAndLabels() throws IOException {
        // When
        SyncReport report = engine.synchronize(divider(), projectDir);

        // Then
        assertThat(report.success()).isTrue();
        assertThat(report.components()).isEqualTo(new SyncReport.ChangeCounts(2, 0, 0, 0));
        assertThat(report.nets().added()).isEqualTo(2);
        assertThat(report.fragmentsWritten()).containsExactly(ROOT_FILE);
        Circuit circuit = readBack();
        assertThat(circuit.components()).extracting(Component::reference).containsExactlyInAnyOrder("R1", "R2");
        assertThat(circuit.net("SIG").orElseThrow().endpoints())
            .containsExactlyInAnyOrder(pin(circuit, "R1", "1"), pin(circuit, "R2", "1"));
        assertThat(circuit.net("GND").orElseThrow().isPower()).isTrue();
        assertThat(Files.readString(projectDir.resolve(ROOT_FILE))).contains("(lib_symbols", "\"Device:R\"");
    }

    @Test
    void synchronize_secondRun_changesNothing() throws IOException {
        engine.synchronize(divider(), projectDir);
        byte[] before = Files.readAllBytes(projectDir.resolve(ROOT_FILE));

        SyncReport second = engine.synchronize(divider(), projectDir);

        assertThat(second.success()).isTrue();
        assertThat(second.hasChanges()).isFalse();
        assertThat(second.components().kept()).isEqualTo(2);
        assertThat(second.fragmentsWritten()).isEmpty();
        assertThat(Files.readAllBytes(projectDir.resolve(ROOT_FILE))).isEqualTo(before);
    }

    @Test
    void synchronize_addedComponent_leavesExistingElementsUntouched() throws IOException {
        // Given
        engine.synchronize(divider(), projectDir);
        List<String> before = elementTexts();

        // When
        CircuitDescription grown = divider();
        ComponentSpec c1 = grown.component("C1", "Device:C").id("cap");
        grown.net("GND").connect(c1, "2");
        SyncReport report = engine.synchronize(grown, projectDir);

        // Then
        assertThat(report.components()).isEqualTo(new SyncReport.ChangeCounts(1, 0, 0, 2));
        assertThat(report.nets().updated()).isEqualTo(1);
        List<String> after = elementTexts();
        assertThat(after).containsAll(before);
        Circuit circuit = readBack();
        assertThat(circuit.net("GND").orElseThrow().endpoints()).contains(pin(circuit, "C1", "2"));
    }

    @Test
    void synchronize_unconnectedAddition_keepsMovedComponentAndAnnotations() throws IOException {
        // Given: R1 moved by hand after the first run
        engine.synchronize(withLooseR1(), projectDir);
        moveSymbol(ROOT_FILE, "R1", new BigDecimal("203.2"), new BigDecimal("127"), 90);
        Circuit before = readBack();
        List<String> labelsBefore = labelTexts();

        // When
        CircuitDescription grown = withLooseR1();
        grown.component("C1", "Device:C").id("cap");
        SyncReport report = engine.synchronize(grown, projectDir);

        // Then
        assertThat(report.components()).isEqualTo(new SyncReport.ChangeCounts(1, 0, 0, 3));
        assertThat(report.nets()).isEqualTo(new SyncReport.ChangeCounts(0, 0, 0, 1));
        Circuit after = readBack();
        assertThat(component(after, "R1").position()).isEqualTo(component(before, "R1").position());
        assertThat(component(after, "R1").position().rotation()).isEqualTo(90);
        assertThat(component(after, "R2").position()).isEqualTo(component(before, "R2").position());
        assertThat(component(after, "C1").position()).isNotIn(
            component(after, "R1").position(), component(after, "R2").position(),
            component(after, "R3").position());
        assertThat(labelTexts()).isEqualTo(labelsBefore);
    }

    @Test
    void synchronize_changedReference_updatesInPlace() throws IOException {
        engine.synchronize(divider(), projectDir);
        Component before = component(readBack(), "R2");

        CircuitDescription renamed = new CircuitDescription();
        ComponentSpec r1 = renamed.component("R1", "Device:R").id("top").property("Value", "10k");
        ComponentSpec r5 = renamed.component("R5", "Device:R").id("bottom").property("Value", "4k7");
        renamed.net("SIG").connect(r1, "1").connect(r5, "1");
        renamed.net("GND").power().connect(r1, "2").connect(r5, "2");
        SyncReport report = engine.synchronize(renamed, projectDir);

        assertThat(report.components().updated()).isEqualTo(1);
        assertThat(report.nets().kept()).isEqualTo(2);
        Component after = component(readBack(), "R5");
        assertThat(after.key()).isEqualTo(before.key());
        assertThat(after.position()).isEqualTo(before.position());
        assertThat(Files.readString(projectDir.resolve(ROOT_FILE))).contains("(reference \"R5\")")
            .doesNotContain("\"R2\"");
    }

    @Test
    void synchronize_changedSymbolType_movesLabelsWithThePins() throws IOException {
        // Given
        engine.synchronize(pair("1"), projectDir);
        Component before = component(readBack(), "R1");

        // When: R1 switches to a symbol with longer pins
        CircuitDescription longer = new CircuitDescription();
        ComponentSpec r1 = longer.component("R1", "Device:R_Long").id("top");
        ComponentSpec r2 = longer.component("R2", "Device:R").id("bottom");
        longer.net("SIG").connect(r1, "1").connect(r2, "1");
        SyncReport report = engine.synchronize(longer, projectDir);
        byte[] written = Files.readAllBytes(projectDir.resolve(ROOT_FILE));
        SyncReport again = engine.synchronize(longer, projectDir);

        // Then
        assertThat(report.components().updated()).isEqualTo(1);
        Circuit circuit = readBack();
        assertThat(component(circuit, "R1").typeId()).isEqualTo("Device:R_Long");
        assertThat(component(circuit, "R1").position()).isEqualTo(before.position());
        assertThat(circuit.net("SIG").orElseThrow().endpoints())
            .containsExactlyInAnyOrder(pin(circuit, "R1", "1"), pin(circuit, "R2", "1"));
        assertThat(labelTexts()).hasSize(2);
        assertThat(again.hasChanges()).isFalse();
        assertThat(again.fragmentsWritten()).isEmpty();
        assertThat(Files.readAllBytes(projectDir.resolve(ROOT_FILE))).isEqualTo(written);
    }

    @Test
    void synchronize_rewiredPin_movesConnection() {
        // Given
        engine.synchronize(pair("1"), projectDir);
        Circuit before = readBack();

        // When
        SyncReport report = engine.synchronize(pair("2"), projectDir);

        // Then
        assertThat(report.components().kept()).isEqualTo(2);
        assertThat(report.nets().updated()).isEqualTo(1);
        Circuit circuit = readBack();
        assertThat(circuit.net("SIG").orElseThrow().endpoints())
            .containsExactlyInAnyOrder(pin(circuit, "R1", "1"), pin(circuit, "R2", "2"));
        assertThat(component(circuit, "R1").position()).isEqualTo(component(before, "R1").position());
        assertThat(component(circuit, "R2").position()).isEqualTo(component(before, "R2").position());
    }

    @Test
    void synchronize_deletedNet_removesItsLabels() throws IOException {
        // Given
        engine.synchronize(pair("1"), projectDir);
        Circuit before = readBack();

        // When
        CircuitDescription unconnected = new CircuitDescription();
        unconnected.component("R1", "Device:R").id("top");
        unconnected.component("R2", "Device:R").id("bottom");
        SyncReport report = engine.synchronize(unconnected, projectDir);

        // Then
        assertThat(report.components()).isEqualTo(new SyncReport.ChangeCounts(0, 0, 0, 2));
        assertThat(report.nets().removed()).isEqualTo(1);
        Circuit after = readBack();
        assertThat(after.nets()).isEmpty();
        assertThat(component(after, "R1").position()).isEqualTo(component(before, "R1").position());
        assertThat(component(after, "R2").position()).isEqualTo(component(before, "R2").position());
        assertThat(Files.readString(projectDir.resolve(ROOT_FILE))).doesNotContain("(label \"SIG\"");
        assertThat(engine.plan(unconnected, projectDir).hasChanges()).isFalse();
    }

    @Test
    void synchronize_prefixOnlyReferences_areNumberedOnceAndKept() {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec a = description.component("R?", "Device:R");
        ComponentSpec b = description.component("R?", "Device:R");
        description.net().connect(a, "2").connect(b, "1");

        engine.synchronize(description, projectDir);
        SyncReport second = engine.synchronize(description, projectDir);

        Circuit circuit = readBack();
        assertThat(circuit.components()).extracting(Component::reference).containsExactlyInAnyOrder("R1", "R2");
        assertThat(circuit.nets()).singleElement().satisfies(net -> assertThat(net.name()).isEqualTo("Net-(R1-Pad2)"));
        assertThat(second.hasChanges()).isFalse();
    }

    @Test
    void synchronize_subcircuitWithPort_connectsThroughSheetPin() {
        // When
        SyncReport first = engine.synchronize(withFilter(), projectDir);
        SyncReport second = engine.synchronize(withFilter(), projectDir);

        // Then
        assertThat(first.instances().added()).isEqualTo(1);
        assertThat(first.fragmentsWritten()).hasSize(2);
        assertThat(second.hasChanges()).isFalse();
        assertThat(second.fragmentsWritten()).isEmpty();
        Circuit circuit = readBack();
        SubcircuitInstance filter = circuit.instances().get(0);
        assertThat(filter.name()).isEqualTo("filter1");
        assertThat(circuit.net("VIN").orElseThrow().endpoints())
            .containsExactlyInAnyOrder(pin(circuit, "R1", "1"), Endpoint.port(filter.key(), "IN"));
        assertThat(filter.body().ports()).extracting(p -> p.name()).containsExactly("IN");
        assertThat(filter.body().net("IN").orElseThrow().endpoints()).hasSize(1);
        assertThat(filter.body().components()).extracting(Component::reference).containsExactly("R3");
    }

    @Test
    void synchronize_emptySubcircuit_keepsFragmentUntilInstanceIsRemoved() {
        // Given: an instance without components
        CircuitDescription empty = new CircuitDescription();
        empty.component("R1", "Device:R").id("top");
        empty.subcircuit("spare", "spare").id("spare");
        SyncReport created = engine.synchronize(empty, projectDir);
        String fragment = readBack().instances().get(0).fileName();
        assertThat(created.fragmentsWritten()).contains(fragment);

        // When: populated, then emptied again
        CircuitDescription populated = new CircuitDescription();
        populated.component("R1", "Device:R").id("top");
        populated.subcircuit("spare", "spare").id("spare").body().component("R9", "Device:R").id("inner");
        SyncReport filled = engine.synchronize(populated, projectDir);
        SyncReport emptied = engine.synchronize(empty, projectDir);

        // Then
        assertThat(filled.components().added()).isEqualTo(1);
        assertThat(emptied.components().removed()).isEqualTo(1);
        assertThat(emptied.fragmentsDeleted()).isEmpty();
        assertThat(projectDir.resolve(fragment)).exists();

        // When: the instance itself goes away
        CircuitDescription without = new CircuitDescription();
        without.component("R1", "Device:R").id("top");
        SyncReport removed = engine.synchronize(without, projectDir);

        // Then
        assertThat(removed.instances().removed()).isEqualTo(1);
        assertThat(removed.fragmentsDeleted()).containsExactly(fragment);
        assertThat(projectDir.resolve(fragment)).doesNotExist();
    }

    @Test
    void synchronize_renamedInstanceWithoutId_keepsItsFragment() throws IOException {
        // Given
        engine.synchronize(namedFilter("filter1"), projectDir);
        SubcircuitInstance before = readBack().instances().get(0);
        byte[] fragmentBefore = Files.readAllBytes(projectDir.resolve(before.fileName()));

        // When
        SyncReport renamed = engine.synchronize(namedFilter("filterA"), projectDir);
        SyncReport again = engine.synchronize(namedFilter("filterA"), projectDir);

        // Then
        assertThat(renamed.instances()).isEqualTo(new SyncReport.ChangeCounts(0, 0, 1, 0));
        assertThat(renamed.components()).isEqualTo(new SyncReport.ChangeCounts(0, 0, 0, 2));
        assertThat(renamed.fragmentsDeleted()).isEmpty();
        assertThat(renamed.fragmentsWritten()).containsExactly(ROOT_FILE);
        assertThat(Files.readAllBytes(projectDir.resolve(before.fileName()))).isEqualTo(fragmentBefore);
        SubcircuitInstance after = readBack().instances().get(0);
        assertThat(after.name()).isEqualTo("filterA");
        assertThat(after.definition()).isEqualTo("rc_filter");
        assertThat(after.fileName()).isEqualTo(before.fileName());
        assertThat(after.key()).isEqualTo(before.key());
        assertThat(again.hasChanges()).isFalse();
    }

    @Test
    void synchronize_repeatedDefinition_keepsInstanceLayoutsApart() throws IOException {
        // Given: two instances of one definition
        engine.synchronize(twoChannels(), projectDir);
        Circuit first = readBack();
        SubcircuitInstance left = instance(first, "left");
        SubcircuitInstance right = instance(first, "right");
        assertThat(left.fileName()).isNotEqualTo(right.fileName());
        assertThat(component(left.body(), "R3").key()).isNotEqualTo(component(right.body(), "R3").key());

        // When: R3 of the left channel is moved by hand
        moveSymbol(left.fileName(), "R3", new BigDecimal("152.4"), new BigDecimal("101.6"), 0);
        byte[] rightBefore = Files.readAllBytes(projectDir.resolve(right.fileName()));
        SyncReport report = engine.synchronize(twoChannels(), projectDir);
        SyncReport again = engine.synchronize(twoChannels(), projectDir);

        // Then
        assertThat(report.success()).isTrue();
        assertThat(report.components().kept()).isEqualTo(3);
        assertThat(report.fragmentsWritten()).doesNotContain(right.fileName(), ROOT_FILE);
        assertThat(Files.readAllBytes(projectDir.resolve(right.fileName()))).isEqualTo(rightBefore);
        Circuit after = readBack();
        Component movedR3 = component(instance(after, "left").body(), "R3");
        assertThat(movedR3.position().samePoint(Position.at("152.4", "101.6"))).isTrue();
        assertThat(component(instance(after, "right").body(), "R3").position())
            .isEqualTo(component(right.body(), "R3").position());
        assertThat(instance(after, "left").body().net("IN").orElseThrow().endpoints())
            .containsExactly(Endpoint.pin(movedR3.key(), "1"));
        assertThat(again.hasChanges()).isFalse();
        assertThat(again.fragmentsWritten()).isEmpty();
    }

    @Test
    void plan_freshProject_writesNothing() throws IOException {
        SyncReport report = engine.plan(divider(), projectDir);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.success()).isTrue();
        assertThat(report.fragmentsWritten()).containsExactly(ROOT_FILE);
        try (Stream<Path> files = Files.list(projectDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void synchronize_malformedFragment_abortsWithoutWriting() throws IOException {
        // Given
        engine.synchronize(withFilter(), projectDir);
        Path root = projectDir.resolve(ROOT_FILE);
        Path child = projectDir.resolve(readBack().instances().get(0).fileName());
        Files.writeString(child, "(kicad_sch (version 20231120)");
        byte[] rootBefore = Files.readAllBytes(root);

        // When
        CircuitDescription changed = withFilter();
        changed.component("R8", "Device:R").id("extra");
        SyncReport report = engine.synchronize(changed, projectDir);

        // Then
        assertThat(report.success()).isFalse();
        assertThat(report.issues()).extracting(SyncIssue::kind).contains(IssueKind.FORMAT_ERROR);
        assertThat(report.fragmentsWritten()).isEmpty();
        assertThat(Files.readAllBytes(root)).isEqualTo(rootBefore);
        assertThat(Files.readString(child)).isEqualTo("(kicad_sch (version 20231120)");
    }

    @Test
    void synchronize_rootNotUtf8_failsWithFormatError() throws IOException {
        // Given: a Latin-1 encoded root
        engine.synchronize(divider(), projectDir);
        Path root = projectDir.resolve(ROOT_FILE);
        byte[] latin1 = Files.readString(root).replace("10k", "10k\u00e9").getBytes(StandardCharsets.ISO_8859_1);
        Files.write(root, latin1);

        // When
        SyncReport report = engine.synchronize(divider(), projectDir);

        // Then
        assertThat(report.success()).isFalse();
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.FORMAT_ERROR);
            assertThat(issue.entity()).isEqualTo(ROOT_FILE);
        });
        assertThat(Files.readAllBytes(root)).isEqualTo(latin1);
    }

    @Test
    void synchronize_duplicateReference_failsWithIdentityConflict() throws IOException {
        CircuitDescription description = new CircuitDescription();
        description.component("R1", "Device:R");
        description.component("R1", "Device:C");

        SyncReport report = engine.synchronize(description, projectDir);

        assertThat(report.success()).isFalse();
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.IDENTITY_CONFLICT);
            assertThat(issue.entity()).isEqualTo("R1");
        });
        try (Stream<Path> files = Files.list(projectDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void synchronize_pinOnTwoNets_failsWithInvalidDescription() {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec r1 = description.component("R1", "Device:R");
        ComponentSpec r2 = description.component("R2", "Device:R");
        description.net("A").connect(r1, "1").connect(r2, "1");
        description.net("B").connect(r1, "1").connect(r2, "2");

        SyncReport report = engine.synchronize(description, projectDir);

        assertThat(report.success()).isFalse();
        assertThat(report.issues()).extracting(SyncIssue::kind).containsExactly(IssueKind.INVALID_DESCRIPTION);
    }

    @Test
    void synchronize_unknownSymbol_warnsAndPlacesPlaceholder() {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec u1 = description.component("U1", "Vendor:Sensor");
        ComponentSpec r1 = description.component("R1", "Device:R");
        description.net("DATA").connect(u1, "3").connect(r1, "1");

        SyncReport report = engine.synchronize(description, projectDir);

        assertThat(report.success()).isTrue();
        assertThat(report.issues()).extracting(SyncIssue::kind).containsExactly(IssueKind.UNRESOLVED_REFERENCE);
        Circuit circuit = readBack();
        assertThat(circuit.net("DATA").orElseThrow().endpoints()).contains(pin(circuit, "U1", "3"));
        assertThat(engine.synchronize(description, projectDir).hasChanges()).isFalse();
    }

    @Test
    void synchronize_preserveUserComponents_keepsUndescribedSymbols() {
        SynchronizationEngine preserving = engine(true);
        preserving.synchronize(divider(), projectDir);

        CircuitDescription smaller = new CircuitDescription();
        smaller.component("R1", "Device:R").id("top").property("Value", "10k");
        SyncReport report = preserving.synchronize(smaller, projectDir);

        assertThat(report.components().removed()).isZero();
        assertThat(report.issues()).extracting(SyncIssue::kind).containsExactly(IssueKind.PRESERVED_COMPONENT);
        assertThat(readBack().components()).extracting(Component::reference).containsExactlyInAnyOrder("R1", "R2");
    }

    private static SynchronizationEngine engine(boolean preserve) {
        SyncConfig config = new SyncConfig(null, null, null, new SyncSettings("amp", preserve));
        return new SynchronizationEngine(config, TestSymbols.library());
    }

    private static CircuitDescription divider() {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec r1 = description.component("R1", "Device:R").id("top").property("Value", "10k");
        ComponentSpec r2 = description.component("R2", "Device:R").id("bottom").property("Value", "4k7");
        description.net("SIG").connect(r1, "1").connect(r2, "1");
        description.net("GND").power().connect(r1, "2").connect(r2, "2");
        return description;
    }

    private static CircuitDescription pair(String r2Pin) {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec r1 = description.component("R1", "Device:R").id("top");
        ComponentSpec r2 = description.component("R2", "Device:R").id("bottom");
        description.net("SIG").connect(r1, "1").connect(r2, r2Pin);
        return description;
    }

    private static CircuitDescription withFilter() {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec r1 = description.component("R1", "Device:R").id("source");
        SubcircuitSpec filter = description.subcircuit("filter1", "rc_filter").id("filter-1");
        ComponentSpec r3 = filter.body().component("R3", "Device:R").id("series");
        filter.body().port("IN").connect(r3, "1");
        description.net("VIN").connect(r1, "1").connect(filter, "IN");
        return description;
    }

    private static CircuitDescription namedFilter(String name) {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec r1 = description.component("R1", "Device:R").id("source");
        SubcircuitSpec filter = description.subcircuit(name, "rc_filter");
        ComponentSpec r3 = filter.body().component("R3", "Device:R").id("series");
        filter.body().port("IN").connect(r3, "1");
        description.net("VIN").connect(r1, "1").connect(filter, "IN");
        return description;
    }

    private static CircuitDescription twoChannels() {
        CircuitDescription description = new CircuitDescription();
        ComponentSpec r1 = description.component("R1", "Device:R").id("source");
        SubcircuitSpec left = description.subcircuit("left", "rc_filter").id("left");
        SubcircuitSpec right = description.subcircuit("right", "rc_filter").id("right");
        for (SubcircuitSpec channel : List.of(left, right)) {
            ComponentSpec r3 = channel.body().component("R3", "Device:R").id("series");
            channel.body().port("IN").connect(r3, "1");
        }
        description.net("VL").connect(r1, "1").connect(left, "IN");
        description.net("VR").connect(r1, "2").connect(right, "IN");
        return description;
    }

    private static CircuitDescription withLooseR1() {
        CircuitDescription description = new CircuitDescription();
        description.component("R1", "Device:R").id("loose");
        ComponentSpec r2 = description.component("R2", "Device:R").id("top");
        ComponentSpec r3 = description.component("R3", "Device:R").id("bottom");
        description.net("SIG").connect(r2, "2").connect(r3, "1");
        return description;
    }

    private Circuit readBack() {
        ProjectStore.LoadResult loaded = new ProjectStore(DocumentSettings.defaults()).load(projectDir, "amp");
        assertThat(loaded.hasErrors()).isFalse();
        return DocumentModels.fromDocument(loaded.project()).circuit();
    }

    private List<String> elementTexts() {
        ProjectDocument project = new ProjectStore(DocumentSettings.defaults()).load(projectDir, "amp").project();
        return Stream.of(SchematicElements.SYMBOL, "label", "global_label")
            .flatMap(head -> project.root().elements(head).stream())
            .map(SExpressionWriter::writeInline)
            .toList();
    }

    private List<String> labelTexts() {
        ProjectDocument project = new ProjectStore(DocumentSettings.defaults()).load(projectDir, "amp").project();
        return project.root().elements("label").stream()
            .map(SExpressionWriter::writeInline)
            .sorted()
            .toList();
    }

    private void moveSymbol(String fileName, String reference, BigDecimal x, BigDecimal y, int angle) {
        ProjectStore store = new ProjectStore(DocumentSettings.defaults());
        ProjectDocument project = store.load(projectDir, "amp").project();
        SchematicDocument fragment = project.fragment(fileName).orElseThrow();
        SList symbol = fragment.elements(SchematicElements.SYMBOL).stream()
            .filter(s -> SchematicElements.property(s, SchematicElements.REFERENCE).orElse("").equals(reference))
            .findFirst()
            .orElseThrow();
        fragment.replace(symbol, symbol.withFirst("at", SchematicElements.at(x, y, angle)));
        store.write(project);
    }

    private static SubcircuitInstance instance(Circuit circuit, String name) {
        return circuit.instances().stream()
            .filter(i -> i.name().equals(name))
            .findFirst()
            .orElseThrow();
    }

    private static Component component(Circuit circuit, String reference) {
        return circuit.components().stream()
            .filter(c -> c.reference().equals(reference))
            .findFirst()
            .orElseThrow();
    }

    private static Endpoint pin(Circuit circuit, String reference, String number) {
        return Endpoint.pin(component(circuit, reference).key(), number);
    }
}
