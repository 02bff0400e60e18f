package work.lcod.staging.artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import work.lcod.staging.shared.FileTrees;

/**
 * Writes zip archives with commons-compress. Entries are added in sorted relative-path order.
 */
public final class ZipArchiveWriter implements ArchiveWriter {
    @Override
    public void write(Path sourceDir, Path archiveFile) throws IOException {
        Path parent = archiveFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var out = new ZipArchiveOutputStream(Files.newOutputStream(archiveFile))) {
            for (Path file : FileTrees.listFiles(sourceDir)) {
                String entryName = sourceDir.relativize(file).toString().replace('\\', '/');
                var entry = new ZipArchiveEntry(file.toFile(), entryName);
                out.putArchiveEntry(entry);
                Files.copy(file, out);
                out.closeArchiveEntry();
            }
            out.finish();
        }
    }
}
