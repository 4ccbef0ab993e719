package com.logsentinel.core.lifecycle;

import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.InMemoryStatusPublisher;
import com.logsentinel.core.port.StatusPublisher;
import com.logsentinel.core.scoring.ArtifactLoader;
import com.logsentinel.core.scoring.LogisticRegressionArtifact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ModelLifecycleManager}.
 */
class ModelLifecycleManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tmp;

    private Path store;
    private Path sources;
    private Clock clock;
    private InMemoryStatusPublisher status;
    private ModelLifecycleManager manager;

    @BeforeEach
    void setUp() throws Exception {
        store = tmp.resolve("store");
        sources = Files.createDirectories(tmp.resolve("sources"));
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        status = new InMemoryStatusPublisher();
        manager = newManager();
    }

    // ------------------------------------------------------------------
    // Import
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should register a validated import as available and copy the bundle into the store")
    void shouldImportValidBundle() throws Exception {
        ModelVersion v1 = manager.importVersion(bundle("v1"), "v1", null, true);

        assertThat(v1.getStatus()).isEqualTo(ModelStatus.AVAILABLE);
        assertThat(v1.getSlot()).isEqualTo(ModelLifecycleManager.DEFAULT_SLOT);
        assertThat(v1.getValidation().isValid()).isTrue();
        assertThat(v1.getMetricsSnapshot()).containsEntry("f1Score", 0.91);
        assertThat(v1.getHistory()).extracting(StatusTransition::getTo)
                .containsExactly(ModelStatus.IMPORTED, ModelStatus.AVAILABLE);
        assertThat(store.resolve("versions").resolve("v1").resolve("model.json")).isRegularFile();
        assertThat(store.resolve(RegistryStore.REGISTRY_FILE)).isRegularFile();

        List<StatusRecord> published = status.history(StatusPublisher.modelKey("v1"));
        assertThat(published).extracting(StatusRecord::getStatus).containsExactly("imported", "available");
    }

    @Test
    @DisplayName("Should reject a duplicate version id and keep the existing entry")
    void shouldRejectDuplicateVersionId() throws Exception {
        ModelVersion original = manager.importVersion(bundle("v1"), "v1", null, true);

        assertThatThrownBy(() -> manager.importVersion(bundle("v1-again"), "v1", null, true))
                .isInstanceOf(RegistryConflictException.class)
                .hasMessageContaining("v1");

        assertThat(manager.listVersions()).containsExactly(original);
        assertThat(manager.getVersion("v1")).isEqualTo(original);
    }

    @Test
    @DisplayName("Should never register the same id twice under concurrent imports")
    void shouldKeepIdsUniqueUnderConcurrentImports() throws Exception {
        List<Path> bundles = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            bundles.add(bundle("race-" + i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (Path b : bundles) {
                Callable<Boolean> task = () -> {
                    go.await();
                    try {
                        manager.importVersion(b, "shared", null, true);
                        return true;
                    } catch (RegistryConflictException e) {
                        return false;
                    }
                };
                results.add(pool.submit(task));
            }
            go.countDown();
            int successes = 0;
            for (Future<Boolean> f : results) {
                if (f.get(30, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(manager.listVersions()).extracting(ModelVersion::getVersionId).containsExactly("shared");
    }

    @Test
    @DisplayName("Should reject a bundle missing metadata and leave the registry unchanged")
    void shouldRejectBundleWithoutMetadata() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, true);
        List<ModelVersion> before = manager.listVersions();
        Path broken = bundle("broken");
        Files.delete(broken.resolve(BundleValidator.METADATA_FILE));

        assertThatThrownBy(() -> manager.importVersion(broken, "broken", null, true))
                .isInstanceOf(BundleValidationException.class)
                .satisfies(e -> assertThat(((BundleValidationException) e).getReport().getErrors())
                        .contains("Missing required file: metadata.json"));

        assertThat(manager.listVersions()).isEqualTo(before);
        assertThat(storedEntries()).containsExactly("v1");
        assertThat(newManager().listVersions()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should keep an unvalidated import in status imported and validate it on deploy")
    void shouldValidateImportedVersionOnDeploy() throws Exception {
        ModelVersion imported = manager.importVersion(bundle("v1"), "v1", null, false);
        assertThat(imported.getStatus()).isEqualTo(ModelStatus.IMPORTED);
        assertThat(imported.getValidation()).isNull();

        manager.deploy("v1");

        ModelVersion deployed = manager.getVersion("v1");
        assertThat(deployed.getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(deployed.getValidation().isValid()).isTrue();
        assertThat(deployed.getHistory()).extracting(StatusTransition::getTo)
                .containsExactly(ModelStatus.IMPORTED, ModelStatus.AVAILABLE, ModelStatus.DEPLOYED);
    }

    @Test
    @DisplayName("Should promote an imported version through validateVersion")
    void shouldPromoteOnValidateVersion() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, false);

        ValidationReport report = manager.validateVersion("v1");

        assertThat(report.isValid()).isTrue();
        assertThat(manager.getVersion("v1").getStatus()).isEqualTo(ModelStatus.AVAILABLE);
    }

    @Test
    @DisplayName("Should import a deployment ZIP and take the version id from its name")
    void shouldImportZipPackage() throws Exception {
        Path zip = TestBundles.zip(bundle("packed"), sources.resolve("model_2026.02_deployment.zip"), "packed");

        ModelVersion version = manager.importVersion(zip);

        assertThat(version.getVersionId()).isEqualTo("2026.02");
        assertThat(version.getStatus()).isEqualTo(ModelStatus.AVAILABLE);
        assertThat(store.resolve("versions").resolve("2026.02").resolve("metadata.json")).isRegularFile();
    }

    @Test
    @DisplayName("Should reject a ZIP entry escaping the extraction directory")
    void shouldRejectZipSlip() throws Exception {
        Path zip = TestBundles.maliciousZip(sources.resolve("model_evil_deployment.zip"));

        assertThatThrownBy(() -> manager.importVersion(zip))
                .isInstanceOf(BundleValidationException.class)
                .hasMessageContaining("evil");

        assertThat(manager.listVersions()).isEmpty();
        assertThat(storedEntries()).isEmpty();
        assertThat(store.resolve("escaped.txt")).doesNotExist();
    }

    @Test
    @DisplayName("Should reject a malformed version id")
    void shouldRejectMalformedVersionId() throws Exception {
        Path b = bundle("v1");
        assertThatThrownBy(() -> manager.importVersion(b, "../v1", null, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Deploy / rollback
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Deploying v3 after v2 should leave v2 available and v3 deployed")
    void shouldDemotePreviousDeployment() throws Exception {
        manager.importVersion(bundle("v2"), "v2", null, true);
        manager.importVersion(bundle("v3"), "v3", null, true);

        manager.deploy("v2");
        manager.deploy("v3");

        assertThat(manager.getVersion("v2").getStatus()).isEqualTo(ModelStatus.AVAILABLE);
        assertThat(manager.getVersion("v3").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(manager.getDeployed("default")).get()
                .extracting(DeployedModel::getVersionId).isEqualTo("v3");
        assertThat(manager.getDeployed("default").get().getArtifact())
                .isInstanceOf(LogisticRegressionArtifact.class);
        assertThat(deployedCount("default")).isEqualTo(1);
    }

    @Test
    @DisplayName("Rollback should redeploy the target and return the replaced version to available")
    void shouldRollBack() throws Exception {
        manager.importVersion(bundle("v2"), "v2", null, true);
        manager.importVersion(bundle("v3"), "v3", null, true);
        manager.deploy("v2");
        manager.deploy("v3");

        assertThat(manager.rollback("v2")).isTrue();

        assertThat(manager.getVersion("v2").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(manager.getVersion("v3").getStatus()).isEqualTo(ModelStatus.AVAILABLE);
        List<ModelStatus> trail = manager.getVersion("v3").getHistory().stream()
                .map(StatusTransition::getTo)
                .collect(Collectors.toList());
        assertThat(trail).endsWith(ModelStatus.DEPLOYED, ModelStatus.ROLLED_BACK, ModelStatus.AVAILABLE);
        assertThat(manager.getDeployed("default").get().getVersionId()).isEqualTo("v2");
        assertThat(deployedCount("default")).isEqualTo(1);

        manager.deploy("v3");
        assertThat(manager.getVersion("v3").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(manager.getVersion("v2").getStatus()).isEqualTo(ModelStatus.AVAILABLE);
    }

    @Test
    @DisplayName("Rollback to a never-validated version should be rejected")
    void shouldRejectRollbackToImportedVersion() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, false);

        assertThatThrownBy(() -> manager.rollback("v1"))
                .isInstanceOf(RegistryConflictException.class);
        assertThat(manager.getVersion("v1").getStatus()).isEqualTo(ModelStatus.IMPORTED);
    }

    @Test
    @DisplayName("Each slot should hold its own deployed version")
    void shouldKeepSlotsIndependent() throws Exception {
        manager.importVersion(bundle("wifi-1"), "wifi-1", "wifi", true);
        manager.importVersion(bundle("dns-1"), "dns-1", "dns", true);

        manager.deploy("wifi-1");
        manager.deploy("dns-1");

        assertThat(manager.getVersion("wifi-1").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(manager.getVersion("dns-1").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(manager.getDeployed("wifi")).isPresent();
        assertThat(manager.getDeployed("dns")).isPresent();
        assertThat(manager.getDeployed("default")).isEmpty();
    }

    @Test
    @DisplayName("Deploy should notify deployment listeners with the loaded artifact")
    void shouldNotifyListeners() throws Exception {
        ModelDeploymentListener listener = mock(ModelDeploymentListener.class);
        manager.addDeploymentListener(listener);
        manager.importVersion(bundle("v1"), "v1", null, true);

        manager.deploy("v1");

        verify(listener).onModelDeployed(argThat(m -> m.getVersionId().equals("v1")
                && m.getSlot().equals("default") && m.getArtifact() != null));
    }

    @Test
    @DisplayName("Should reload the deployed artifact when the store is reopened")
    void shouldRestoreDeployedOnStartup() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, true);
        manager.deploy("v1");

        ModelLifecycleManager reopened = newManager();

        assertThat(reopened.getVersion("v1").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
        assertThat(reopened.getDeployed("default")).get()
                .extracting(DeployedModel::getVersionId).isEqualTo("v1");
    }

    @Test
    @DisplayName("Unknown versions should raise ModelNotFoundException")
    void shouldRaiseNotFound() {
        assertThatThrownBy(() -> manager.deploy("nope")).isInstanceOf(ModelNotFoundException.class);
        assertThatThrownBy(() -> manager.getVersion("nope")).isInstanceOf(ModelNotFoundException.class);
        assertThat(manager.findVersion("nope")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Delete
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Deleting the deployed version should be rejected with the registry unchanged")
    void shouldRejectDeleteOfDeployedVersion() throws Exception {
        manager.importVersion(bundle("v3"), "v3", null, true);
        manager.deploy("v3");
        List<ModelVersion> before = manager.listVersions();

        assertThatThrownBy(() -> manager.delete("v3"))
                .isInstanceOf(RegistryConflictException.class)
                .hasMessageContaining("deployed");

        assertThat(manager.listVersions()).isEqualTo(before);
        assertThat(storedEntries()).containsExactly("v3");
    }

    @Test
    @DisplayName("Deleting a version referenced by an agent should be rejected")
    void shouldRejectDeleteOfReferencedVersion() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, true);
        manager.setReferenceChecker(id -> id.equals("v1"));

        assertThatThrownBy(() -> manager.delete("v1"))
                .isInstanceOf(RegistryConflictException.class)
                .hasMessageContaining("referenced");
        assertThat(manager.findVersion("v1")).isPresent();
    }

    @Test
    @DisplayName("Deleting an available version should remove its entry and bundle")
    void shouldDeleteAvailableVersion() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, true);
        manager.importVersion(bundle("v2"), "v2", null, true);
        manager.deploy("v2");

        assertThat(manager.delete("v1")).isTrue();

        assertThat(manager.findVersion("v1")).isEmpty();
        assertThat(storedEntries()).containsExactly("v2");
        assertThat(status.latest(StatusPublisher.modelKey("v1"))).get()
                .extracting(StatusRecord::getStatus).isEqualTo("deleted");
        assertThat(newManager().findVersion("v1")).isEmpty();
    }

    @Test
    @DisplayName("A failing status publisher should not fail registry operations")
    void shouldTolerateStatusPublisherFailure() throws Exception {
        StatusPublisher failing = (key, record) -> {
            throw new IllegalStateException("status store down");
        };
        ModelLifecycleManager m = new ModelLifecycleManager(tmp.resolve("other"), failing, clock,
                new ArtifactLoader());

        m.importVersion(bundle("v1"), "v1", null, true);
        m.deploy("v1");

        assertThat(m.getVersion("v1").getStatus()).isEqualTo(ModelStatus.DEPLOYED);
    }

    @Test
    @DisplayName("Should read a version's metadata")
    void shouldReadMetadata() throws Exception {
        manager.importVersion(bundle("v1"), "v1", null, true);

        ModelMetadata metadata = manager.getMetadata("v1");

        assertThat(metadata.getModelInfo().getVersion()).isEqualTo("v1");
        assertThat(metadata.getTrainingInfo().getSampleCount()).isEqualTo(5000L);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ModelLifecycleManager newManager() {
        return new ModelLifecycleManager(store, status, clock, new ArtifactLoader());
    }

    private Path bundle(String name) throws Exception {
        return TestBundles.validBundle(sources, name, NOW.minus(Duration.ofDays(1)));
    }

    private long deployedCount(String slot) {
        return manager.listVersions().stream()
                .filter(v -> v.getSlot().equals(slot) && v.getStatus() == ModelStatus.DEPLOYED)
                .count();
    }

    private List<String> storedEntries() throws Exception {
        try (Stream<Path> list = Files.list(store.resolve("versions"))) {
            return list.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
