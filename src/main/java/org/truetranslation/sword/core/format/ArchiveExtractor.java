package org.truetranslation.sword.core.format;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;

/**
 * Unpacks module packages and repository indexes into a SWORD directory.
 * Every entry path is checked before anything is written: an archive with
 * a single entry resolving outside the destination is rejected as a whole.
 */
public final class ArchiveExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);

    private ArchiveExtractor() {
    }

    /**
     * Extracts a {@code .zip} module package.
     *
     * @return number of regular files written
     * @throws UnsafeArchiveEntryException if an entry escapes {@code destDir}
     */
    public static int extractZipArchive(byte[] data, Path destDir) throws IOException {
        Path root = destDir.toAbsolutePath().normalize();
        try (ZipFile zipFile = new ZipFile(new SeekableInMemoryByteChannel(data))) {
            List<ZipArchiveEntry> entries = Collections.list(zipFile.getEntries());
            for (ZipArchiveEntry entry : entries) {
                resolveInside(root, entry.getName());
            }

            int written = 0;
            for (ZipArchiveEntry entry : entries) {
                Path target = resolveInside(root, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zipFile.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                written++;
            }
            LOG.debug("Extracted {} files into {}", written, root);
            return written;
        }
    }

    /**
     * Extracts a {@code mods.d.tar.gz} index.
     *
     * @return number of regular files written
     * @throws UnsafeArchiveEntryException if an entry escapes {@code destDir}
     */
    public static int extractModsArchive(byte[] data, Path destDir) throws IOException {
        Path root = destDir.toAbsolutePath().normalize();

        // First pass only validates names.
        try (TarArchiveInputStream tar = openTar(data)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                resolveInside(root, entry.getName());
            }
        }

        int written = 0;
        try (TarArchiveInputStream tar = openTar(data)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path target = resolveInside(root, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                    written++;
                } else {
                    LOG.debug("Skipping non-regular tar entry {}", entry.getName());
                }
            }
        }
        LOG.debug("Extracted {} files into {}", written, root);
        return written;
    }

    private static TarArchiveInputStream openTar(byte[] data) throws IOException {
        return new TarArchiveInputStream(new GzipCompressorInputStream(new ByteArrayInputStream(data)));
    }

    static Path resolveInside(Path root, String entryName) throws UnsafeArchiveEntryException {
        Path target = root.resolve(entryName).normalize();
        if (!target.equals(root) && !target.startsWith(root)) {
            throw new UnsafeArchiveEntryException(entryName);
        }
        return target;
    }
}
