package ai.pipestream.filevault.storage;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds deterministic object paths using SHA-256 based sharding.
 * <p>
 * Layout: {@code {base}/{h[0..s)}/{h[s..2s)}/.../{objectId}[.ext]} where {@code h} is the
 * lowercase hex SHA-256 of the UTF-8 object id, {@code s} the shard symbol count, and the number
 * of segments the shard level count. Segment generation stops early if the hash runs out.
 * </p>
 */
public class ObjectPathMapper {

    private static final Logger LOG = Logger.getLogger(ObjectPathMapper.class);
    private static final String TEMP_SUFFIX = ".uploading";
    private static final Joiner SLASH = Joiner.on('/');

    private final Path basePath;
    private final Path tempDirectory;
    private final int shardSymbolCount;
    private final int shardLevelCount;
    private final AtomicLong lastTempStamp = new AtomicLong();

    public ObjectPathMapper(Path basePath, String tempDirName, int shardSymbolCount, int shardLevelCount) {
        if (shardSymbolCount <= 0 || shardLevelCount <= 0) {
            throw new IllegalArgumentException(String.format(
                    "shard symbol and level counts must be positive, got %d and %d", shardSymbolCount, shardLevelCount));
        }
        this.basePath = basePath.toAbsolutePath().normalize();
        this.tempDirectory = this.basePath.resolve(tempDirName).normalize();
        this.shardSymbolCount = shardSymbolCount;
        this.shardLevelCount = shardLevelCount;
        LOG.debugf("ObjectPathMapper initialized: basePath=%s, tempDir=%s, symbols=%d, levels=%d",
                this.basePath, this.tempDirectory, shardSymbolCount, shardLevelCount);
    }

    /**
     * Whether an object id can be used verbatim as a leaf filename.
     *
     * @param objectId the caller-supplied id
     * @return false for ids that would address a different directory
     */
    public static boolean isSafeObjectId(String objectId) {
        return objectId != null
                && objectId.indexOf('/') < 0
                && objectId.indexOf('\\') < 0
                && objectId.indexOf('\0') < 0
                && !objectId.equals(".")
                && !objectId.equals("..");
    }

    public Path finalPath(String objectId) {
        return finalPath(objectId, null);
    }

    /**
     * Canonical (unversioned) location of an object.
     */
    public Path finalPath(String objectId, String extension) {
        requireObjectId(objectId);
        Path path = basePath;
        for (String segment : shardSegments(objectId)) {
            path = path.resolve(segment);
        }
        return path.resolve(buildFilename(objectId, extension));
    }

    public Path tempPath(String objectId) {
        return tempPath(objectId, null);
    }

    /**
     * Fresh temp location for an upload attempt. Every call returns a distinct path.
     */
    public Path tempPath(String objectId, String extension) {
        requireObjectId(objectId);
        String filename = buildFilename(objectId, extension);
        return tempDirectory.resolve(filename + "_" + nextTempStamp() + TEMP_SUFFIX);
    }

    /**
     * Key under which writers of this object are serialized. Identity on the object id.
     */
    public String lockKey(String objectId) {
        requireObjectId(objectId);
        return objectId;
    }

    public String relativePath(String objectId) {
        return relativePath(objectId, null);
    }

    /**
     * Canonical location relative to the base path, '/' separated.
     */
    public String relativePath(String objectId, String extension) {
        requireObjectId(objectId);
        List<String> parts = new ArrayList<>(shardSegments(objectId));
        parts.add(buildFilename(objectId, extension));
        return SLASH.join(parts);
    }

    /**
     * Insert a {@code _version} suffix before the extension of a canonical path.
     * {@code a/b/report.pdf} with version 2 becomes {@code a/b/report_2.pdf}.
     */
    public Path versionedPath(Path canonicalPath, int version) {
        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive, got " + version);
        }
        String filename = canonicalPath.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String versioned = dot > 0
                ? filename.substring(0, dot) + "_" + version + filename.substring(dot)
                : filename + "_" + version;
        return canonicalPath.resolveSibling(versioned);
    }

    /**
     * Resolve a caller-supplied relative path (as returned by an upload) under the base path.
     *
     * @throws IllegalArgumentException if the path leaves the base path or points at temp files
     */
    public Path resolveRelative(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relative path must not be blank");
        }
        Path resolved = basePath.resolve(relativePath).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new IllegalArgumentException("path escapes the storage base path");
        }
        if (resolved.startsWith(tempDirectory)) {
            throw new IllegalArgumentException("path points into the temp directory");
        }
        return resolved;
    }

    /**
     * Path relative to the base path, '/' separated regardless of platform.
     */
    public String relativize(Path path) {
        Path relative = basePath.relativize(path.toAbsolutePath().normalize());
        List<String> parts = new ArrayList<>(relative.getNameCount());
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return SLASH.join(parts);
    }

    public Path basePath() {
        return basePath;
    }

    public Path tempDirectory() {
        return tempDirectory;
    }

    List<String> shardSegments(String objectId) {
        String hash = Hashing.sha256().hashString(objectId, StandardCharsets.UTF_8).toString();
        List<String> segments = new ArrayList<>(shardLevelCount);
        int position = 0;
        for (int level = 0; level < shardLevelCount; level++) {
            if (position + shardSymbolCount > hash.length()) {
                break;
            }
            segments.add(hash.substring(position, position + shardSymbolCount));
            position += shardSymbolCount;
        }
        return segments;
    }

    private static String buildFilename(String objectId, String extension) {
        if (extension == null || extension.isBlank()) {
            return objectId;
        }
        return extension.startsWith(".") ? objectId + extension : objectId + "." + extension;
    }

    private long nextTempStamp() {
        Instant now = Instant.now();
        long nanos = TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        return lastTempStamp.accumulateAndGet(nanos, (previous, candidate) -> Math.max(previous + 1, candidate));
    }

    private static void requireObjectId(String objectId) {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("ObjectId cannot be null or whitespace");
        }
        if (!isSafeObjectId(objectId)) {
            throw new IllegalArgumentException("ObjectId must not contain path separators: " + objectId);
        }
    }
}
