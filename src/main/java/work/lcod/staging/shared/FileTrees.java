package work.lcod.staging.shared;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Filesystem walking and copying helpers shared by the merge engine and the stages.
 */
public final class FileTrees {
    private FileTrees() {}

    /**
     * Lists every regular file below {@code root}, sorted by relative path so callers see a
     * stable order regardless of what the filesystem returns.
     */
    public static List<Path> listFiles(Path root) throws IOException {
        return listFiles(root, path -> true);
    }

    public static List<Path> listFiles(Path root, Predicate<Path> filter) throws IOException {
        List<Path> files = new ArrayList<>();
        if (root == null || !Files.isDirectory(root)) {
            return files;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && filter.test(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.comparing(path -> root.relativize(path).toString()));
        return files;
    }

    /**
     * Copies every file below {@code source} into {@code destination}, keeping relative paths.
     *
     * @return the written destination files, in source order
     */
    public static List<Path> copyTree(Path source, Path destination) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Path file : listFiles(source)) {
            Path target = destination.resolve(source.relativize(file).toString());
            copyFile(file, target);
            written.add(target);
        }
        return written;
    }

    public static void copyFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Removes {@code root} and everything below it. Missing directories are ignored.
     */
    public static void deleteTree(Path root) throws IOException {
        if (root == null || Files.notExists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
