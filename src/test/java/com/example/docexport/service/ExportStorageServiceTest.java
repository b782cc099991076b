package com.example.docexport.service;

import com.example.docexport.config.StorageProperties;
import com.example.docexport.exception.ExportStorageException;
import com.example.docexport.model.StoredExport;
import com.example.docexport.storage.FileSystemObjectStorageClient;
import com.example.docexport.storage.ObjectAcl;
import com.example.docexport.storage.ObjectStorageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("Export Storage Tests")
public class ExportStorageServiceTest {

    @TempDir
    Path root;

    private StorageProperties properties;
    private ExportStorageService service;

    @BeforeEach
    public void setup() {
        properties = new StorageProperties(root.toString(), "exports", "http://files.local/", Duration.ofSeconds(900), "test-secret");
        service = new ExportStorageService(new FileSystemObjectStorageClient(properties), properties);
    }

    @Test
    @DisplayName("Saved exports land under export/{shelf}/{user}/{filename}")
    public void testSaveWritesObjectAndReturnsUrl() throws IOException {
        StoredExport stored = service.save("shelf-1", "user-9", "Handbook", new byte[]{1, 2, 3});

        assertEquals("export/shelf-1/user-9/Handbook.docx", stored.getKey());
        assertTrue(stored.getUrl().startsWith("http://files.local/exports/export/shelf-1/user-9/Handbook.docx?expires="));
        Path file = root.resolve("exports").resolve("export/shelf-1/user-9/Handbook.docx");
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(file));
    }

    @Test
    @DisplayName("Uploads are private with a 900 second download URL")
    public void testUploadUsesPrivateAclAndTtl() throws IOException {
        ObjectStorageClient client = mock(ObjectStorageClient.class);
        when(client.presignedGet(anyString(), anyString(), any())).thenReturn("signed");
        ExportStorageService mocked = new ExportStorageService(client, properties);

        StoredExport stored = mocked.save("s", "u", "a.docx", new byte[0]);

        assertEquals("signed", stored.getUrl());
        verify(client).put(eq("exports"), eq("export/s/u/a.docx"), any(), eq(DocxOutputService.CONTENT_TYPE), eq(ObjectAcl.PRIVATE));
        verify(client).presignedGet("exports", "export/s/u/a.docx", Duration.ofSeconds(900));
    }

    @Test
    public void testStoreFailureIsWrapped() throws IOException {
        ObjectStorageClient client = mock(ObjectStorageClient.class);
        when(client.put(anyString(), anyString(), any(), anyString(), any())).thenThrow(new IOException("disk full"));
        ExportStorageService failing = new ExportStorageService(client, properties);

        ExportStorageException e = assertThrows(ExportStorageException.class,
                () -> failing.save("s", "u", "a", new byte[0]));
        assertTrue(e.getMessage().contains("export/s/u/a.docx"));
    }

    @Test
    public void testObjectKeySanitizing() {
        assertEquals("export/unknown/unknown/export.docx", ExportStorageService.objectKey(null, " ", null));
        assertEquals("export/a_b/u/Q_A.docx", ExportStorageService.objectKey("a/b", "u", "Q?A"));
        assertEquals("export/s/u/Report.DOCX", ExportStorageService.objectKey("s", "u", "Report.DOCX"));
    }

    @Test
    public void testRemove() {
        service.save("s", "u", "gone", new byte[]{9});

        service.remove("export/s/u/gone.docx");

        assertFalse(Files.exists(root.resolve("exports/export/s/u/gone.docx")));
        assertThrows(IllegalArgumentException.class, () -> service.remove("other/s/u/gone.docx"));
    }
}
