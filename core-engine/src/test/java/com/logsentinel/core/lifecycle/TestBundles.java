package com.logsentinel.core.lifecycle;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes model bundles for tests.
 */
public final class TestBundles {

    /** Probability rises with authFailures: p(12 failures) is about 0.998. */
    public static final String LOGISTIC_MODEL = "{"
            + "\"format\": \"logistic_regression\","
            + "\"featureNames\": [\"authFailures\", \"deauthCount\"],"
            + "\"coefficients\": [0.8, 0.1],"
            + "\"intercept\": -3.5}";

    private TestBundles() {
    }

    /**
     * A complete, valid bundle with a logistic artifact.
     */
    public static Path validBundle(Path parent, String name, Instant createdAt) throws IOException {
        Path dir = Files.createDirectories(parent.resolve(name));
        Files.writeString(dir.resolve("model.json"), LOGISTIC_MODEL);
        Files.writeString(dir.resolve("metadata.json"), metadata(name, createdAt, 0.91));
        Files.writeString(dir.resolve("README.md"), "# " + name + "\n");
        Files.writeString(dir.resolve("inference_example.py"), "print('example')\n");
        Files.writeString(dir.resolve("validate_model.py"), "print('validate')\n");
        Files.writeString(dir.resolve(BundleValidator.MANIFEST_FILE), "{\"fileHashes\": {\"model.json\": \""
                + BundleValidator.sha256(dir.resolve("model.json")) + "\"}}");
        return dir;
    }

    public static String metadata(String version, Instant createdAt, double f1) {
        return "{"
                + "\"modelInfo\": {\"version\": \"" + version + "\", \"modelType\": \"logistic_regression\","
                + " \"createdAt\": \"" + createdAt + "\"},"
                + "\"trainingInfo\": {\"featureNames\": [\"authFailures\", \"deauthCount\"], \"sampleCount\": 5000},"
                + "\"evaluationInfo\": {\"basicMetrics\": {\"f1Score\": " + String.format(Locale.ROOT, "%.2f", f1)
                + ", \"rocAuc\": 0.95, \"precision\": 0.9, \"recall\": 0.88}}}";
    }

    /**
     * Pack a bundle directory into a ZIP, optionally wrapped in a top-level
     * folder.
     */
    public static Path zip(Path bundleDir, Path zipFile, String wrapper) throws IOException {
        List<Path> files;
        try (Stream<Path> list = Files.list(bundleDir)) {
            files = list.sorted().collect(Collectors.toList());
        }
        try (OutputStream out = Files.newOutputStream(zipFile); ZipOutputStream zos = new ZipOutputStream(out)) {
            for (Path file : files) {
                String name = (wrapper != null ? wrapper + "/" : "") + file.getFileName();
                zos.putNextEntry(new ZipEntry(name));
                zos.write(Files.readAllBytes(file));
                zos.closeEntry();
            }
        }
        return zipFile;
    }

    /** A ZIP whose single entry escapes the extraction directory. */
    public static Path maliciousZip(Path zipFile) throws IOException {
        try (OutputStream out = Files.newOutputStream(zipFile); ZipOutputStream zos = new ZipOutputStream(out)) {
            zos.putNextEntry(new ZipEntry("../../escaped.txt"));
            zos.write("gotcha".getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        return zipFile;
    }
}
