package cn.edu.bit.vaultsync.server;

import static org.junit.jupiter.api.Assertions.*;

import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

import cn.edu.bit.vaultsync.config.VaultSyncConfig;

public class VaultSyncTest {

    @TempDir
    Path tempDir;

    @Test
    public void testParsePort() {
        assertEquals(8000, VaultSync.parsePort(new String[0], 8000));
        assertEquals(9090, VaultSync.parsePort(new String[] { "9090" }, 8000));
        assertEquals(8000, VaultSync.parsePort(new String[] { "70000" }, 8000));
        assertEquals(8000, VaultSync.parsePort(new String[] { "0" }, 8000));
        assertEquals(8000, VaultSync.parsePort(new String[] { "http" }, 8000));
    }

    @Test
    public void testServesRootListingAndStops() throws Exception {
        var config = new VaultSyncConfig(ConfigFactory.load()
                .withValue("vaultsync.database.path",
                        ConfigValueFactory.fromAnyRef(tempDir.resolve("server.db").toString()))
                .withValue("vaultsync.store.data-directory",
                        ConfigValueFactory.fromAnyRef(tempDir.resolve("data").toString()))
                .withValue("vaultsync.store.tmp-directory",
                        ConfigValueFactory.fromAnyRef(tempDir.resolve("tmp").toString())));

        try (var server = new VaultSync(config, 0)) {
            server.bind();
            int port = ((InetSocketAddress) server.channel().localAddress()).getPort();

            var connection = (HttpURLConnection) new URL("http://127.0.0.1:" + port + "/").openConnection();
            try {
                assertEquals(200, connection.getResponseCode());
                assertTrue(connection.getContentType().startsWith("application/json"));
                String body = new String(connection.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                assertEquals("[]", body);
            } finally {
                connection.disconnect();
            }

            var missing = (HttpURLConnection) new URL("http://127.0.0.1:" + port + "/nope.bin").openConnection();
            try {
                assertEquals(404, missing.getResponseCode());
            } finally {
                missing.disconnect();
            }

            assertThrows(IllegalStateException.class, server::bind);
        }
    }
}
