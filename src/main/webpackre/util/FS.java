package webpackre.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

public class FS {

    public static abstract class CollectingFileVisitor extends SimpleFileVisitor<Path> {
        private final Path root;
        private final List<Path> result = new ArrayList<>();

        public CollectingFileVisitor(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
            if (!dir.equals(root) && dir.toFile().isHidden()) {
                return FileVisitResult.SKIP_SUBTREE;
            } else {
                return super.preVisitDirectory(dir, attrs);
            }
        }

        public abstract boolean keep(Path path);

        @Override
        public FileVisitResult visitFile(Path path, BasicFileAttributes attrs) throws IOException {
            if (!path.toFile().isHidden() && keep(root.relativize(path))) {
                result.add(path);
            }
            return FileVisitResult.CONTINUE;
        }

        public List<Path> getResult() {
            return result;
        }
    }

    /**
     * finds all files matching given extension recursively, in walk order
     */
    public static List<Path> findFilesByExt(Path root, String ext) throws IOException {
        final PathMatcher matcher = root.getFileSystem().getPathMatcher("glob:*." + ext);
        CollectingFileVisitor visitor = new CollectingFileVisitor(root) {
            @Override
            public boolean keep(Path path) {
                return matcher.matches(path.getFileName()); // only matches the filename, path is ignored
            }
        };
        Files.walkFileTree(root, new HashSet<>(), Integer.MAX_VALUE, visitor);
        return visitor.getResult();
    }

    /**
     * resolves a module id below dir, ids escaping dir are flattened into it
     */
    public static Path outputFile(Path dir, String id, String ext) {
        Path file = dir.resolve(id + "." + ext).normalize();
        if (!file.startsWith(dir.normalize())) {
            file = dir.resolve(id.replaceAll("[/\\\\:]", "_") + "." + ext);
        }
        return file;
    }
}
