package com.example.docexport.storage;

import com.example.docexport.config.StorageProperties;
import com.example.docexport.exception.DownloadLinkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class FileSystemObjectStorageClientTest {

    @TempDir
    Path root;

    private FileSystemObjectStorageClient client;

    @BeforeEach
    public void setup() {
        client = new FileSystemObjectStorageClient(
                new StorageProperties(root.toString(), "bucket", "http://localhost:8080/files", Duration.ofMinutes(15), "test-secret"));
    }

    @Test
    public void testPutOverwritesAndReturnsUrl() throws IOException {
        client.put("bucket", "a/b.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        String url = client.put("bucket", "a/b.docx", new byte[]{2, 2}, "application/octet-stream", ObjectAcl.PRIVATE);

        assertEquals("http://localhost:8080/files/bucket/a/b.docx", url);
        assertArrayEquals(new byte[]{2, 2}, Files.readAllBytes(root.resolve("bucket/a/b.docx")));
    }

    @Test
    public void testPresignedUrlCarriesExpiry() throws IOException {
        client.put("bucket", "k.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        long before = Instant.now().getEpochSecond();

        String url = client.presignedGet("bucket", "k.docx", Duration.ofSeconds(900));

        long expires = Long.parseLong(query(url, "expires"));
        assertTrue(url.startsWith("http://localhost:8080/files/bucket/k.docx?"));
        assertTrue(expires >= before + 900);
        assertTrue(expires <= Instant.now().getEpochSecond() + 900);
    }

    @Test
    public void testSignedUrlOpensStoredFile() throws IOException {
        client.put("bucket", "a/k.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        String url = client.presignedGet("bucket", "a/k.docx", Duration.ofSeconds(900));

        Path file = client.openSigned("bucket", "a/k.docx", Long.parseLong(query(url, "expires")), query(url, "signature"));

        assertEquals(root.resolve("bucket/a/k.docx").toAbsolutePath().normalize(), file);
    }

    @Test
    public void testExpiredUrlIsRejected() throws IOException {
        client.put("bucket", "k.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        String url = client.presignedGet("bucket", "k.docx", Duration.ofSeconds(-5));

        DownloadLinkException ex = assertThrows(DownloadLinkException.class, () -> client.openSigned(
                "bucket", "k.docx", Long.parseLong(query(url, "expires")), query(url, "signature")));
        assertTrue(ex.getMessage().contains("expired"));
    }

    @Test
    public void testTamperedUrlIsRejected() throws IOException {
        client.put("bucket", "k.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        client.put("bucket", "other.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        String url = client.presignedGet("bucket", "k.docx", Duration.ofSeconds(900));
        long expires = Long.parseLong(query(url, "expires"));
        String signature = query(url, "signature");

        assertThrows(DownloadLinkException.class, () -> client.openSigned("bucket", "other.docx", expires, signature));
        assertThrows(DownloadLinkException.class, () -> client.openSigned("bucket", "k.docx", expires + 3600, signature));
        assertThrows(DownloadLinkException.class, () -> client.openSigned("bucket", "k.docx", expires, null));
    }

    @Test
    public void testSignedUrlForDeletedObjectIsNotFound() throws IOException {
        client.put("bucket", "k.docx", new byte[]{1}, "application/octet-stream", ObjectAcl.PRIVATE);
        String url = client.presignedGet("bucket", "k.docx", Duration.ofSeconds(900));
        client.delete("bucket", "k.docx");

        assertThrows(NoSuchFileException.class, () -> client.openSigned(
                "bucket", "k.docx", Long.parseLong(query(url, "expires")), query(url, "signature")));
    }

    private static String query(String url, String name) {
        for (String pair : url.substring(url.indexOf('?') + 1).split("&")) {
            if (pair.startsWith(name + "=")) {
                return pair.substring(name.length() + 1);
            }
        }
        return null;
    }

    @Test
    public void testPresignMissingObjectFails() {
        assertThrows(NoSuchFileException.class, () -> client.presignedGet("bucket", "missing.docx", Duration.ofSeconds(1)));
    }

    @Test
    public void testKeysCannotEscapeBucket() {
        assertThrows(IllegalArgumentException.class,
                () -> client.put("bucket", "../../etc/passwd", new byte[0], "text/plain", ObjectAcl.PRIVATE));
    }

    @Test
    public void testDeleteMissingObjectIsQuiet() throws IOException {
        client.delete("bucket", "never-there.docx");
        assertFalse(Files.exists(root.resolve("bucket/never-there.docx")));
    }
}
