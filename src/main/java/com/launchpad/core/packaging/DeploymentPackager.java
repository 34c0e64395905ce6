package com.launchpad.core.packaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Zips a publish directory into the deployment archive uploaded to the host.
 * Entry names are relative to the publish directory and always use forward slashes.
 */
@Service
public class DeploymentPackager {

    private static final Logger log = LoggerFactory.getLogger(DeploymentPackager.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * Creates {@code projectDir/zipName} from {@code artifactDir}. When an older archive with that
     * name cannot be deleted (typically locked by another process), a timestamped name is used.
     *
     * @return the archive that was written
     */
    public Path createPackage(Path projectDir, Path artifactDir, String zipName) throws IOException {
        Path zipPath = projectDir.resolve(zipName);
        if (Files.exists(zipPath)) {
            try {
                Files.delete(zipPath);
            } catch (IOException e) {
                Path alternative = projectDir.resolve(timestampedName(zipName, LocalDateTime.now()));
                log.warn("Could not delete existing {} ({}), writing {} instead",
                        zipPath.getFileName(), e.getMessage(), alternative.getFileName());
                zipPath = alternative;
            }
        }

        log.info("Creating deployment package {}...", zipPath.getFileName());
        int entries = 0;
        try (OutputStream out = Files.newOutputStream(zipPath);
             ZipOutputStream zip = new ZipOutputStream(out);
             Stream<Path> walk = Files.walk(artifactDir)) {
            List<Path> files = walk.filter(Files::isRegularFile).sorted().toList();
            for (Path file : files) {
                String entryName = artifactDir.relativize(file).toString().replace('\\', '/');
                zip.putNextEntry(new ZipEntry(entryName));
                Files.copy(file, zip);
                zip.closeEntry();
                entries++;
            }
        }
        log.info("Deployment package {} created with {} files ({} bytes)",
                zipPath.getFileName(), entries, Files.size(zipPath));
        return zipPath;
    }

    /**
     * True for a {@code .zip} file that holds {@code manifestFileName} at its root, which is how
     * every archive written by {@link #createPackage} looks, whatever name it was given.
     */
    public static boolean isDeploymentArchive(Path file, String manifestFileName) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".zip") || !Files.isRegularFile(file)) {
            return false;
        }
        try (var zip = new ZipFile(file.toFile())) {
            return zip.getEntry(manifestFileName) != null;
        } catch (IOException e) {
            log.debug("{} is not a readable archive: {}", file, e.getMessage());
            return false;
        }
    }

    static String timestampedName(String zipName, LocalDateTime now) {
        int dot = zipName.lastIndexOf('.');
        String stem = dot > 0 ? zipName.substring(0, dot) : zipName;
        String extension = dot > 0 ? zipName.substring(dot) : "";
        return stem + "_" + TIMESTAMP.format(now) + extension;
    }
}
