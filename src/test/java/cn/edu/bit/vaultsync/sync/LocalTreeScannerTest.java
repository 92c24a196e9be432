package cn.edu.bit.vaultsync.sync;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LocalTreeScannerTest {
    @TempDir
    Path root;

    @Test
    public void testScanUsesSlashSeparatedRelativePaths() throws IOException {
        Files.createDirectories(root.resolve("docs/2024"));
        Files.createDirectories(root.resolve("empty"));
        Files.writeString(root.resolve("top.txt"), "top");
        Path nested = Files.writeString(root.resolve("docs/2024/report.txt"), "nested!");
        Files.setLastModifiedTime(nested, FileTime.from(Instant.ofEpochSecond(1_700_000_000L)));

        List<TreeEntry> entries = LocalTreeScanner.scan(root);
        assertEquals(2, entries.size());
        TreeEntry report = entries.stream().filter(e -> e.relativePath().equals("docs/2024/report.txt"))
                .findFirst().orElseThrow();
        assertEquals(7, report.size());
        assertEquals(1_700_000_000L, report.mtimeSeconds());
        assertTrue(entries.stream().anyMatch(e -> e.relativePath().equals("top.txt")));
    }

    @Test
    public void testScanRejectsRegularFile() throws IOException {
        Path file = Files.writeString(root.resolve("file.txt"), "x");
        assertThrows(IOException.class, () -> LocalTreeScanner.scan(file));
    }
}
