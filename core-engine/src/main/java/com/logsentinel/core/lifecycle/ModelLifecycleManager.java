package com.logsentinel.core.lifecycle;

import com.logsentinel.core.model.StatusRecord;
import com.logsentinel.core.port.StatusPublisher;
import com.logsentinel.core.scoring.ArtifactLoader;
import com.logsentinel.core.scoring.ModelLoadException;
import com.logsentinel.core.scoring.ScoringArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owns the versioned registry of scoring artifacts and the deploy/rollback
 * state machine.
 *
 * <h3>State machine</h3>
 *
 * <pre>
 * imported -&gt; available -&gt; deployed &lt;-&gt; rolled_back
 * </pre>
 * <p>
 * Deploying a version demotes the slot's previous version to
 * {@code available}. Rolling back to a version records the previous one as
 * {@code rolled_back} and returns it to {@code available} in the same
 * commit. Any version that is not deployed can be deleted unless
 * an agent references it.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Every mutating operation runs under one {@link ReentrantLock} covering the
 * whole read-modify-write of the registry file. Readers use a volatile
 * immutable snapshot and never block. Loaded artifacts are published per slot
 * as immutable {@link DeployedModel} values after the registry has been
 * written, then {@link ModelDeploymentListener}s are notified outside the
 * lock.
 * </p>
 *
 * <h3>Store layout</h3>
 *
 * <pre>
 * &lt;storeRoot&gt;/model_registry.json
 * &lt;storeRoot&gt;/versions/&lt;versionId&gt;/model.json
 * &lt;storeRoot&gt;/versions/&lt;versionId&gt;/metadata.json
 * </pre>
 *
 * @since 1.0.0
 */
public class ModelLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(ModelLifecycleManager.class);

    public static final String VERSIONS_DIR = "versions";
    public static final String DEFAULT_SLOT = "default";

    /** Allowed characters for version ids and slot names. */
    public static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private static final Pattern PACKAGE_NAME = Pattern.compile("model_(.+)_deployment\\.zip",
            Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter VERSION_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final Path storeRoot;
    private final Path versionsDir;
    private final RegistryStore store;
    private final ArtifactLoader artifactLoader;
    private final BundleValidator validator;
    private final StatusPublisher statusPublisher;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Map<String, ModelVersion> versions;
    private final Map<String, DeployedModel> deployed = new ConcurrentHashMap<>();
    private final Set<ModelDeploymentListener> listeners = new CopyOnWriteArraySet<>();
    private volatile ModelReferenceChecker referenceChecker = ModelReferenceChecker.NONE;

    public ModelLifecycleManager(Path storeRoot, StatusPublisher statusPublisher) {
        this(storeRoot, statusPublisher, Clock.systemUTC(), new ArtifactLoader());
    }

    /**
     * Open (or create) the store and reload the artifact of every deployed
     * version.
     *
     * @throws UncheckedIOException if the store cannot be created or the
     *                              registry file cannot be read
     */
    public ModelLifecycleManager(Path storeRoot, StatusPublisher statusPublisher, Clock clock,
            ArtifactLoader artifactLoader) {
        this.storeRoot = Objects.requireNonNull(storeRoot, "storeRoot must not be null");
        this.statusPublisher = Objects.requireNonNull(statusPublisher, "statusPublisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.artifactLoader = Objects.requireNonNull(artifactLoader, "artifactLoader must not be null");
        this.validator = new BundleValidator(artifactLoader, clock);
        this.versionsDir = storeRoot.resolve(VERSIONS_DIR);
        this.store = new RegistryStore(storeRoot);
        try {
            Files.createDirectories(versionsDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create model store " + versionsDir, e);
        }
        this.versions = freeze(store.read());
        restoreDeployed();
    }

    // ---------------------------------------------------------------
    // Collaborators
    // ---------------------------------------------------------------

    public void setReferenceChecker(ModelReferenceChecker referenceChecker) {
        this.referenceChecker = referenceChecker != null ? referenceChecker : ModelReferenceChecker.NONE;
    }

    public void addDeploymentListener(ModelDeploymentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeDeploymentListener(ModelDeploymentListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------
    // Import / validate
    // ---------------------------------------------------------------

    /** Import with full validation, default id and default slot. */
    public ModelVersion importVersion(Path source) {
        return importVersion(source, null, null, true);
    }

    public ModelVersion importVersion(Path source, boolean validate) {
        return importVersion(source, null, null, validate);
    }

    /**
     * Copy a bundle directory or deployment ZIP into the store and register
     * it.
     *
     * <p>
     * With {@code validate} the bundle is fully validated and registered as
     * {@code available}; without, only the required files are checked and it
     * stays {@code imported}. Any failure leaves the registry and the store
     * unchanged.
     * </p>
     *
     * @param source    bundle directory or {@code .zip} package
     * @param versionId id to register under; {@code null} derives one from
     *                  the package name or the import time
     * @param slot      deployment slot; {@code null} for {@value #DEFAULT_SLOT}
     * @param validate  run full validation
     * @return the registered version
     * @throws BundleValidationException if the bundle is rejected
     * @throws RegistryConflictException if the version id already exists
     * @throws IllegalArgumentException  if the id or slot is malformed
     */
    public ModelVersion importVersion(Path source, String versionId, String slot, boolean validate) {
        Objects.requireNonNull(source, "source must not be null");
        String slotName = slot == null || slot.isBlank() ? DEFAULT_SLOT : slot;
        requireId(slotName, "slot");

        lock.lock();
        try {
            String id = versionId != null && !versionId.isBlank() ? versionId : defaultVersionId(source);
            requireId(id, "version id");
            if (versions.containsKey(id)) {
                throw new RegistryConflictException("Model version already exists: " + id);
            }
            Path target = versionsDir.resolve(id);
            if (Files.exists(target)) {
                throw new RegistryConflictException("Bundle directory already exists for version " + id);
            }
            if (!Files.exists(source)) {
                throw new BundleValidationException("Import of version '" + id + "' failed",
                        ValidationReport.builder().error("Import source not found: " + source)
                                .build(clock.instant()));
            }

            Path staging = createStaging();
            try {
                Path bundle = stage(source, staging, id);
                ValidationReport report = validate ? validator.validate(bundle) : validator.checkStructure(bundle);
                if (!report.isValid()) {
                    throw new BundleValidationException("Import of version '" + id + "' failed", report);
                }
                moveInto(bundle, target);

                Instant now = clock.instant();
                ModelVersion version = new ModelVersion(id, slotName, target.toString(), now, ModelStatus.IMPORTED,
                        validate ? report : null, metricsOf(target),
                        List.of(new StatusTransition(null, ModelStatus.IMPORTED, now,
                                "imported from " + source.getFileName())));
                if (validate) {
                    version = version.transition(ModelStatus.AVAILABLE, now, "validation passed");
                }

                Map<String, ModelVersion> next = new LinkedHashMap<>(versions);
                next.put(id, version);
                try {
                    store.write(next);
                } catch (UncheckedIOException e) {
                    removeBundle(target);
                    throw e;
                }
                versions = freeze(next);
                publishTransitions(null, version);
                LOG.info("Imported model version {} into slot {} ({}, {} warning(s))", id, slotName,
                        version.getStatus().getValue(), report.getWarnings().size());
                return version;
            } finally {
                removeBundle(staging);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validate a bundle directory without touching the registry.
     */
    public ValidationReport validateBundle(Path bundleDir) {
        return validator.validate(bundleDir);
    }

    /**
     * Re-validate a stored version, record the report and promote
     * {@code imported} to {@code available} when it passes.
     *
     * @throws ModelNotFoundException if the version does not exist
     */
    public ValidationReport validateVersion(String versionId) {
        lock.lock();
        try {
            ModelVersion current = require(versionId);
            ValidationReport report = validator.validate(directoryOf(current));
            ModelVersion updated = current.withValidation(report);
            if (report.isValid() && current.getStatus() == ModelStatus.IMPORTED) {
                updated = updated.transition(ModelStatus.AVAILABLE, clock.instant(), "validation passed");
            }
            commit(List.of(updated));
            publishTransitions(current, updated);
            return report;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Deploy / rollback / delete
    // ---------------------------------------------------------------

    /**
     * Load a version and make it the slot's deployed version. The previously
     * deployed version of the slot becomes {@code available}. An
     * {@code imported} version is validated first.
     *
     * @return {@code true} once the version is deployed
     * @throws ModelNotFoundException    if the version does not exist
     * @throws BundleValidationException if validation of an imported version
     *                                   fails
     * @throws ModelLoadException        if the artifact cannot be loaded; the
     *                                   registry is unchanged
     */
    public boolean deploy(String versionId) {
        DeployedModel published;
        lock.lock();
        try {
            ModelVersion target = require(versionId);
            if (target.getStatus() == ModelStatus.DEPLOYED) {
                ensureLoaded(target);
                return true;
            }
            if (target.getStatus() == ModelStatus.IMPORTED) {
                ValidationReport report = validator.validate(directoryOf(target));
                if (!report.isValid()) {
                    throw new BundleValidationException("Cannot deploy version '" + versionId + "'", report);
                }
                target = target.withValidation(report)
                        .transition(ModelStatus.AVAILABLE, clock.instant(), "validated on deploy");
            } else if (!target.getStatus().isAvailable()) {
                throw new RegistryConflictException("Cannot deploy version '" + versionId + "' in status "
                        + target.getStatus().getValue());
            }
            ScoringArtifact artifact = loadDeployable(target);
            published = activate(target, artifact,
                    (prior, at) -> prior.transition(ModelStatus.AVAILABLE, at, "superseded by " + versionId),
                    "deployed");
        } finally {
            lock.unlock();
        }
        notifyListeners(published);
        return true;
    }

    /**
     * Return a slot to an earlier, already validated version without
     * re-validating it. The version deployed before the rollback passes
     * through {@code rolled_back} and ends {@code available}.
     *
     * @return {@code true} once the version is deployed
     * @throws ModelNotFoundException    if the version does not exist
     * @throws RegistryConflictException if the version was never validated
     * @throws ModelLoadException        if the artifact cannot be loaded
     */
    public boolean rollback(String versionId) {
        DeployedModel published;
        lock.lock();
        try {
            ModelVersion target = require(versionId);
            if (target.getStatus() == ModelStatus.DEPLOYED) {
                ensureLoaded(target);
                return true;
            }
            if (!target.getStatus().isAvailable()) {
                throw new RegistryConflictException("Cannot roll back to version '" + versionId + "' in status "
                        + target.getStatus().getValue() + "; it has not been validated");
            }
            ScoringArtifact artifact = loadDeployable(target);
            published = activate(target, artifact,
                    (prior, at) -> prior.transition(ModelStatus.ROLLED_BACK, at, "rolled back to " + versionId)
                            .transition(ModelStatus.AVAILABLE, at, "available after rollback"),
                    "rollback target");
        } finally {
            lock.unlock();
        }
        notifyListeners(published);
        return true;
    }

    /**
     * Remove a version from the registry and the store.
     *
     * @return {@code true} once removed
     * @throws ModelNotFoundException    if the version does not exist
     * @throws RegistryConflictException if the version is deployed or
     *                                   referenced by an agent
     */
    public boolean delete(String versionId) {
        lock.lock();
        try {
            ModelVersion current = require(versionId);
            if (current.getStatus() == ModelStatus.DEPLOYED) {
                throw new RegistryConflictException("Cannot delete deployed version '" + versionId
                        + "'; deploy or roll back to another version first");
            }
            if (referenceChecker.isModelReferenced(versionId)) {
                throw new RegistryConflictException("Cannot delete version '" + versionId
                        + "'; it is referenced by an active agent");
            }
            Map<String, ModelVersion> next = new LinkedHashMap<>(versions);
            next.remove(versionId);
            store.write(next);
            versions = freeze(next);
            removeBundle(directoryOf(current));

            Map<String, Object> attrs = attributes(current);
            attrs.put("previousStatus", current.getStatus().getValue());
            publish(versionId, ModelStatus.DELETED, attrs);
            LOG.info("Deleted model version {}", versionId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return every registered version ordered by creation time; never
     *         blocks
     */
    public List<ModelVersion> listVersions() {
        List<ModelVersion> list = new ArrayList<>(versions.values());
        list.sort(Comparator.comparing(ModelVersion::getCreatedAt).thenComparing(ModelVersion::getVersionId));
        return Collections.unmodifiableList(list);
    }

    public Optional<ModelVersion> findVersion(String versionId) {
        return Optional.ofNullable(versions.get(versionId));
    }

    /**
     * @throws ModelNotFoundException if the version does not exist
     */
    public ModelVersion getVersion(String versionId) {
        return findVersion(versionId).orElseThrow(() -> new ModelNotFoundException(versionId));
    }

    /**
     * @throws ModelNotFoundException if the version does not exist
     * @throws ModelLoadException     if the metadata file cannot be read
     */
    public ModelMetadata getMetadata(String versionId) {
        return validator.readMetadata(directoryOf(getVersion(versionId)));
    }

    /**
     * @return the artifact deployed to {@code slot}, if any
     */
    public Optional<DeployedModel> getDeployed(String slot) {
        return Optional.ofNullable(deployed.get(slot));
    }

    /**
     * Load an artifact outside the registry, for agents pinned to a path.
     *
     * @param path bundle directory or artifact file
     * @throws ModelLoadException if the artifact cannot be loaded or cannot
     *                            predict
     */
    public ScoringArtifact loadArtifact(Path path) {
        ScoringArtifact artifact = artifactLoader.load(path);
        if (!artifact.hasPredictCapability()) {
            throw new ModelLoadException("Artifact at " + path + " (" + artifact.getFormat()
                    + ") exposes no predict capability");
        }
        return artifact;
    }

    public Path getStoreRoot() {
        return storeRoot;
    }

    public Path directoryOf(ModelVersion version) {
        return Path.of(version.getArtifactPath());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Make {@code target} the deployed version of its slot. Caller holds the lock. */
    private DeployedModel activate(ModelVersion target, ScoringArtifact artifact,
            BiFunction<ModelVersion, Instant, ModelVersion> demote, String note) {
        Instant now = clock.instant();
        Map<String, ModelVersion> before = versions;
        List<ModelVersion> changed = new ArrayList<>();
        for (ModelVersion other : before.values()) {
            if (other.getSlot().equals(target.getSlot()) && other.getStatus() == ModelStatus.DEPLOYED
                    && !other.getVersionId().equals(target.getVersionId())) {
                changed.add(demote.apply(other, now));
            }
        }
        ModelVersion deployedVersion = target.transition(ModelStatus.DEPLOYED, now, note);
        changed.add(deployedVersion);
        commit(changed);

        DeployedModel model = new DeployedModel(deployedVersion.getVersionId(), deployedVersion.getSlot(),
                artifact, now);
        deployed.put(model.getSlot(), model);
        for (ModelVersion v : changed) {
            publishTransitions(before.get(v.getVersionId()), v);
        }
        LOG.info("Model version {} {} to slot {}", deployedVersion.getVersionId(), note, deployedVersion.getSlot());
        return model;
    }

    /** Write the registry with {@code updated} replacing entries, then swap the snapshot. */
    private void commit(List<ModelVersion> updated) {
        Map<String, ModelVersion> next = new LinkedHashMap<>(versions);
        for (ModelVersion v : updated) {
            next.put(v.getVersionId(), v);
        }
        store.write(next);
        versions = freeze(next);
    }

    private ScoringArtifact loadDeployable(ModelVersion version) {
        return loadArtifact(directoryOf(version));
    }

    private void ensureLoaded(ModelVersion version) {
        DeployedModel current = deployed.get(version.getSlot());
        if (current == null || !current.getVersionId().equals(version.getVersionId())) {
            deployed.put(version.getSlot(), new DeployedModel(version.getVersionId(), version.getSlot(),
                    loadDeployable(version), clock.instant()));
        }
    }

    private void restoreDeployed() {
        Map<String, ModelVersion> bySlot = new LinkedHashMap<>();
        List<ModelVersion> demoted = new ArrayList<>();
        for (ModelVersion v : versions.values()) {
            if (v.getStatus() != ModelStatus.DEPLOYED) {
                continue;
            }
            ModelVersion existing = bySlot.get(v.getSlot());
            if (existing == null) {
                bySlot.put(v.getSlot(), v);
                continue;
            }
            // keep the most recently deployed version of the slot
            ModelVersion keep = lastChange(v).isAfter(lastChange(existing)) ? v : existing;
            ModelVersion drop = keep == v ? existing : v;
            bySlot.put(v.getSlot(), keep);
            demoted.add(drop.transition(ModelStatus.AVAILABLE, clock.instant(), "demoted on registry load"));
        }
        if (!demoted.isEmpty()) {
            LOG.warn("Registry held several deployed versions per slot; demoted {}", demoted);
            commit(demoted);
        }
        for (ModelVersion v : bySlot.values()) {
            try {
                ensureLoaded(v);
                LOG.info("Restored deployed model version {} for slot {}", v.getVersionId(), v.getSlot());
            } catch (ModelLoadException e) {
                LOG.error("Deployed model version {} could not be loaded: {}", v.getVersionId(), e.getMessage());
            }
        }
    }

    private static Instant lastChange(ModelVersion v) {
        List<StatusTransition> history = v.getHistory();
        return history.isEmpty() ? v.getCreatedAt() : history.get(history.size() - 1).getAt();
    }

    private ModelVersion require(String versionId) {
        Objects.requireNonNull(versionId, "versionId must not be null");
        ModelVersion v = versions.get(versionId);
        if (v == null) {
            throw new ModelNotFoundException(versionId);
        }
        return v;
    }

    private String defaultVersionId(Path source) {
        Path name = source.getFileName();
        if (name != null) {
            Matcher m = PACKAGE_NAME.matcher(name.toString());
            if (m.matches() && ID_PATTERN.matcher(m.group(1)).matches()) {
                return m.group(1);
            }
        }
        return VERSION_ID_FORMAT.format(clock.instant());
    }

    private static void requireId(String value, String what) {
        if (!ID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " '" + value + "'; allowed: " + ID_PATTERN);
        }
    }

    private Path createStaging() {
        try {
            return Files.createTempDirectory(versionsDir, ".import-");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create staging directory in " + versionsDir, e);
        }
    }

    private Path stage(Path source, Path staging, String id) {
        Path bundle = staging.resolve("bundle");
        if (Files.isDirectory(source)) {
            try {
                BundleFiles.copyDirectory(source, bundle);
                return bundle;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot copy bundle " + source, e);
            }
        }
        String fileName = String.valueOf(source.getFileName());
        if (!fileName.toLowerCase().endsWith(".zip")) {
            throw new BundleValidationException("Import of version '" + id + "' failed",
                    ValidationReport.builder()
                            .error("Unsupported import source (expected directory or .zip): " + fileName)
                            .build(clock.instant()));
        }
        try {
            BundleFiles.extractZip(source, bundle);
            return BundleFiles.bundleRoot(bundle);
        } catch (IOException e) {
            throw new BundleValidationException("Import of version '" + id + "' failed",
                    ValidationReport.builder().error("Cannot unpack " + fileName + ": " + e.getMessage())
                            .build(clock.instant()));
        }
    }

    private static void moveInto(Path bundle, Path target) {
        try {
            Files.move(bundle, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot move bundle into " + target, e);
        }
    }

    private Map<String, Double> metricsOf(Path bundleDir) {
        try {
            return validator.readMetadata(bundleDir).metricsSnapshot();
        } catch (ModelLoadException e) {
            LOG.debug("No metrics snapshot for {}: {}", bundleDir, e.getMessage());
            return Map.of();
        }
    }

    private static void removeBundle(Path dir) {
        try {
            BundleFiles.deleteRecursively(dir);
        } catch (IOException e) {
            LOG.warn("Could not remove {}: {}", dir, e.getMessage());
        }
    }

    private static Map<String, ModelVersion> freeze(Map<String, ModelVersion> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    // ---------------------------------------------------------------
    // Status publication
    // ---------------------------------------------------------------

    private void publishTransitions(ModelVersion before, ModelVersion after) {
        int from = before != null ? before.getHistory().size() : 0;
        List<StatusTransition> history = after.getHistory();
        if (from >= history.size()) {
            // validation refreshed without a status change
            publish(after.getVersionId(), after.getStatus(), attributes(after));
            return;
        }
        for (StatusTransition t : history.subList(from, history.size())) {
            Map<String, Object> attrs = attributes(after);
            attrs.put("previousStatus", t.getFrom() != null ? t.getFrom().getValue() : null);
            attrs.put("note", t.getNote());
            publish(after.getVersionId(), t.getTo(), attrs);
        }
    }

    private static Map<String, Object> attributes(ModelVersion v) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("slot", v.getSlot());
        attrs.put("artifactPath", v.getArtifactPath());
        attrs.put("createdAt", v.getCreatedAt().toString());
        if (v.getValidation() != null) {
            attrs.put("valid", v.getValidation().isValid());
            attrs.put("warnings", v.getValidation().getWarnings().size());
        }
        if (!v.getMetricsSnapshot().isEmpty()) {
            attrs.put("metrics", v.getMetricsSnapshot());
        }
        return attrs;
    }

    private void publish(String versionId, ModelStatus status, Map<String, Object> attrs) {
        try {
            statusPublisher.publish(StatusPublisher.modelKey(versionId),
                    new StatusRecord(versionId, status.getValue(), clock.instant(), attrs));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish status for model version {}: {}", versionId, e.getMessage());
        }
    }

    private void notifyListeners(DeployedModel model) {
        for (ModelDeploymentListener listener : listeners) {
            try {
                listener.onModelDeployed(model);
            } catch (RuntimeException e) {
                LOG.warn("Deployment listener {} failed for {}: {}", listener, model.getVersionId(), e.getMessage());
            }
        }
    }
}
