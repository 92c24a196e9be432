package cn.edu.bit.vaultsync.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 遍历本地目录，只收集普通文件
 */
public final class LocalTreeScanner {

    private LocalTreeScanner() {
    }

    public static List<TreeEntry> scan(Path root) throws IOException {
        List<TreeEntry> entries = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                if (!Files.isRegularFile(path)) {
                    continue;
                }
                entries.add(new TreeEntry(relativize(root, path), Files.size(path),
                        Files.getLastModifiedTime(path).to(TimeUnit.SECONDS)));
            }
        }
        return entries;
    }

    static String relativize(Path root, Path path) {
        var builder = new StringBuilder();
        for (Path part : root.relativize(path)) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(part);
        }
        return builder.toString();
    }
}
