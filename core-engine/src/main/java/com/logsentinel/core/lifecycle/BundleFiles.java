package com.logsentinel.core.lifecycle;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * File operations on bundle directories and deployment packages.
 *
 * @since 1.0.0
 */
final class BundleFiles {

    private BundleFiles() {
    }

    /**
     * Copy a directory tree. {@code target} must not exist.
     */
    static void copyDirectory(Path source, Path target) throws IOException {
        try (Stream<Path> paths = Files.walk(source)) {
            for (Path p : (Iterable<Path>) paths::iterator) {
                Path dest = target.resolve(source.relativize(p).toString());
                if (Files.isDirectory(p)) {
                    Files.createDirectories(dest);
                } else {
                    Files.copy(p, dest, StandardCopyOption.COPY_ATTRIBUTES);
                }
            }
        }
    }

    /**
     * Extract a ZIP package into {@code target}, rejecting entries that would
     * land outside it.
     *
     * @throws IOException if the archive is unreadable or an entry escapes
     *                     the target directory
     */
    static void extractZip(Path zip, Path target) throws IOException {
        Path base = target.toAbsolutePath().normalize();
        Files.createDirectories(base);
        try (InputStream in = Files.newInputStream(zip); ZipInputStream zin = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                Path dest = base.resolve(entry.getName()).normalize();
                if (!dest.startsWith(base)) {
                    throw new IOException("ZIP entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(dest);
                } else {
                    Files.createDirectories(dest.getParent());
                    Files.copy(zin, dest, StandardCopyOption.REPLACE_EXISTING);
                }
                zin.closeEntry();
            }
        }
    }

    /**
     * A package that wraps its files in one top-level directory is unwrapped
     * to that directory.
     *
     * @return the directory holding the bundle files
     */
    static Path bundleRoot(Path extracted) throws IOException {
        if (Files.isRegularFile(extracted.resolve(BundleValidator.METADATA_FILE))) {
            return extracted;
        }
        List<Path> children;
        try (Stream<Path> list = Files.list(extracted)) {
            children = list.collect(Collectors.toList());
        }
        if (children.size() == 1 && Files.isDirectory(children.get(0))) {
            return children.get(0);
        }
        return extracted;
    }

    /**
     * Delete a directory tree; a missing directory is not an error.
     */
    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        }
    }
}
