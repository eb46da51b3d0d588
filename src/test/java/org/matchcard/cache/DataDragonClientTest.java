package org.matchcard.cache;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.matchcard.StubHttpServer;
import org.matchcard.StubHttpServer.Reply;
import org.matchcard.TestMatches;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.Assert.*;

public class DataDragonClientTest {
    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private StubHttpServer server;
    private DataDragonClient client;

    @Before
    public void setUp() throws IOException {
        server = new StubHttpServer();
        client = new DataDragonClient();
    }

    @After
    public void tearDown() {
        server.close();
    }

    @Test
    public void testDownloadReturnsBody() throws Exception {
        byte[] png = TestMatches.pngBytes(Color.GREEN);
        server.on("/cdn/14.1.1/img/item/1001.png", Reply.bytes(png));

        byte[] body = client.download(server.uri("/cdn/14.1.1/img/item/1001.png"), Duration.ofSeconds(5));

        assertArrayEquals(png, body);
    }

    @Test(expected = IOException.class)
    public void testNotFoundIsAnError() throws Exception {
        client.download(server.uri("/cdn/14.1.1/img/champion/Nobody.png"), Duration.ofSeconds(5));
    }

    @Test(expected = IOException.class)
    public void testEmptyBodyIsAnError() throws Exception {
        server.on("/empty.png", Reply.status(200));
        client.download(server.uri("/empty.png"), Duration.ofSeconds(5));
    }

    @Test
    public void testLatestVersionReadsFirstManifestEntry() throws Exception {
        server.on("/api/versions.json", Reply.json("[\"14.3.1\", \"14.2.1\", \"14.1.1\"]"));

        assertEquals("14.3.1", client.latestVersion(server.uri("/api/versions.json")));
    }

    @Test(expected = IOException.class)
    public void testEmptyManifestIsAnError() throws Exception {
        server.on("/api/versions.json", Reply.json("[]"));
        client.latestVersion(server.uri("/api/versions.json"));
    }

    @Test
    public void testCacheDownloadsThroughHttp() throws Exception {
        server.on("/cdn/14.1.1/img/champion/Ahri.png", Reply.bytes(TestMatches.pngBytes(Color.PINK)));
        Path root = temp.newFolder("ddragon-http").toPath();
        AssetCache cache = new AssetCache(root, server.uri("/cdn"), "14.1.1", client, Duration.ofSeconds(5));

        assertTrue(cache.championIcon("Ahri").isPresent());
        assertFalse(cache.itemIcon(9999).isPresent());
        assertEquals(2, server.seen().size());
    }
}
