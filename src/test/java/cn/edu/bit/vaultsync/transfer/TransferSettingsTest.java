package cn.edu.bit.vaultsync.transfer;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class TransferSettingsTest {

    @Test
    public void testBackoffDoublesUpToMax() {
        var settings = TransferSettings.defaults().withRetries(10, Duration.ofMillis(100), Duration.ofSeconds(1));
        assertEquals(Duration.ZERO, settings.backoff(0));
        assertEquals(Duration.ofMillis(100), settings.backoff(1));
        assertEquals(Duration.ofMillis(200), settings.backoff(2));
        assertEquals(Duration.ofMillis(400), settings.backoff(3));
        assertEquals(Duration.ofMillis(800), settings.backoff(4));
        assertEquals(Duration.ofSeconds(1), settings.backoff(5));
        assertEquals(Duration.ofSeconds(1), settings.backoff(64));
    }

    @Test
    public void testInvalidSettingsRejected() {
        var defaults = TransferSettings.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withChunkSize(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withConcurrency(0, 1));
        assertThrows(IllegalArgumentException.class,
                () -> defaults.withRetries(0, Duration.ZERO, Duration.ZERO));
    }

    @Test
    public void testDownloadStrategySelection() {
        long chunk = 4L * 1024 * 1024;
        assertEquals(DownloadStrategy.MULTI_CONNECTION, DownloadStrategy.select(2, 100, 4, chunk));
        assertEquals(DownloadStrategy.MULTI_FILE, DownloadStrategy.select(100, 100 * 1024, 4, chunk));
        assertEquals(DownloadStrategy.MULTI_CONNECTION, DownloadStrategy.select(10, 10 * 2 * chunk, 4, chunk));
        assertEquals(DownloadStrategy.MULTI_CONNECTION, DownloadStrategy.select(0, 0, 4, chunk));
    }
}
