package com.example.docexport.storage;

import com.example.docexport.config.StorageProperties;
import com.example.docexport.exception.DownloadLinkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Object store backed by a local directory, laid out as {root}/{bucket}/{key}.
 *
 * Presigned URLs point at {@code {publicBaseUrl}/{bucket}/{key}} and carry an
 * {@code expires} epoch second plus an HMAC-SHA256 {@code signature} over
 * bucket, key and expiry. {@link #openSigned} checks both before a file is
 * handed out.
 */
@Slf4j
@Component
public class FileSystemObjectStorageClient implements ObjectStorageClient {

    private static final String HMAC = "HmacSHA256";

    private final StorageProperties properties;
    private final SecretKeySpec signingKey;

    public FileSystemObjectStorageClient(StorageProperties properties) {
        this.properties = properties;
        this.signingKey = new SecretKeySpec(secretBytes(properties.getSigningSecret()), HMAC);
    }

    @Override
    public String put(String bucket, String key, byte[] content, String contentType, ObjectAcl acl) throws IOException {
        Path target = resolve(bucket, key);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".upload", ".tmp");
        Files.write(tmp, content);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Stored {} bytes ({}, {}) at {}", content.length, contentType, acl, target);
        return url(bucket, key);
    }

    @Override
    public String presignedGet(String bucket, String key, Duration ttl) throws IOException {
        if (!Files.exists(resolve(bucket, key))) {
            throw new NoSuchFileException(bucket + "/" + key);
        }
        long expires = Instant.now().plus(ttl).getEpochSecond();
        return url(bucket, key) + "?expires=" + expires + "&signature=" + sign(bucket, key, expires);
    }

    @Override
    public void delete(String bucket, String key) throws IOException {
        boolean removed = Files.deleteIfExists(resolve(bucket, key));
        log.info("Delete {}/{}: {}", bucket, key, removed ? "removed" : "not found");
    }

    /**
     * Resolves the file behind a presigned URL.
     *
     * @throws DownloadLinkException if the signature does not match or the link has expired
     * @throws NoSuchFileException if the object is gone
     */
    public Path openSigned(String bucket, String key, long expires, String signature) throws IOException {
        String expected = sign(bucket, key, expires);
        byte[] given = signature == null ? new byte[0] : signature.getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII), given)) {
            throw new DownloadLinkException("Invalid signature for " + bucket + "/" + key);
        }
        if (Instant.now().getEpochSecond() > expires) {
            throw new DownloadLinkException("Download link for " + bucket + "/" + key + " has expired");
        }
        Path target = resolve(bucket, key);
        if (!Files.isRegularFile(target)) {
            throw new NoSuchFileException(bucket + "/" + key);
        }
        return target;
    }

    private String sign(String bucket, String key, long expires) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(signingKey);
            byte[] digest = mac.doFinal((bucket + "\n" + key + "\n" + expires).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC signing unavailable", e);
        }
    }

    private static byte[] secretBytes(String secret) {
        if (secret != null && !secret.isBlank()) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
        log.warn("No storage signing secret configured, download links will not survive a restart");
        byte[] random = new byte[32];
        new SecureRandom().nextBytes(random);
        return random;
    }

    private Path resolve(String bucket, String key) {
        Path bucketRoot = Path.of(properties.getRootDirectory(), bucket).toAbsolutePath().normalize();
        Path target = bucketRoot.resolve(key).normalize();
        if (!target.startsWith(bucketRoot)) {
            throw new IllegalArgumentException("Key escapes bucket: " + key);
        }
        return target;
    }

    private String url(String bucket, String key) {
        String base = properties.getPublicBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + bucket + "/" + key;
    }
}
