package com.fsnode.app.node;

import com.fsnode.app.cache.CacheEntry;
import com.fsnode.app.cache.TtlCache;
import com.fsnode.app.config.FsOptions;
import com.fsnode.app.exception.FsOperationException;
import com.fsnode.app.exception.InvalidArgumentsException;
import com.fsnode.app.exception.NodeInvariantException;
import com.fsnode.app.exception.StructuralConflictException;
import com.fsnode.app.exception.UnsupportedParentException;
import com.fsnode.app.io.Attempt;
import com.fsnode.app.io.ContentEncoder;
import com.fsnode.app.io.FsOperations;
import com.fsnode.app.io.IoErrorCode;
import com.fsnode.app.io.RetryingOperation;
import com.fsnode.app.path.PathLike;
import com.fsnode.app.path.PathResolver;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * A filesystem entry, memoized per canonical path by its {@link NodeCache}.
 * <p>
 * Metadata is computed on demand and served from time-limited caches (stat, directory listing,
 * file contents). Every OS call goes through {@link RetryingOperation}, so a missing or busy
 * entry gets one more chance before the failure counts. Reads never throw for a missing entry:
 * they yield {@link NodeKind#ABSENT}, empty lists or empty optionals. Mutations raise
 * {@link StructuralConflictException} when the filesystem has the wrong shape, and drop every
 * cached attribute of the node (and of its ancestors) once they succeed.
 * <p>
 * Not thread-safe: calls on the same node from several threads must be serialized by the caller.
 */
public class FsNode implements PathLike {

    private static final Logger logger = LoggerFactory.getLogger(FsNode.class);

    private final String path;
    private final Path file;
    private final NodeCache owner;

    // null = unknown; an entry holding Optional.empty() = absent
    CacheEntry<Optional<BasicFileAttributes>> cachedStat;
    CacheEntry<List<FsNode>> cachedChildren;
    CacheEntry<byte[]> cachedData;

    private FsNode parent;
    private final AsyncFsNode async;

    FsNode(String path, NodeCache owner) {
        this.path = path;
        this.owner = owner;
        this.file = Path.of(owner.resolver().absolute(path));
        this.async = new AsyncFsNode(this);
    }

    @Override
    public String path() {
        return path;
    }

    /** Absolute location handed to the OS calls. */
    public Path file() {
        return file;
    }

    @Override
    public String toString() {
        return path;
    }

    public List<String> parts() {
        return List.of(path.split("/", -1));
    }

    public String name() {
        return FilenameUtils.getName(path);
    }

    /** Extension without the dot, empty when there is none. */
    public String extension() {
        return FilenameUtils.getExtension(name());
    }

    /** The non-blocking view of this node; it shares this node's caches. */
    public AsyncFsNode async() {
        return async;
    }

    // ----------------- metadata -----------------

    /**
     * Raw attributes, empty when the entry is missing or could not be read. Never throws.
     */
    public Optional<BasicFileAttributes> stat() {
        cachedStat = ttl().get(cachedStat, this::statNow, options().statMaxAge());
        return statValue();
    }

    public NodeKind kind() {
        return NodeKind.of(stat().orElse(null));
    }

    /** True only when confirmed; use {@link #kind()} to tell "a folder" from "nothing there". */
    public boolean isFile() {
        return kind() == NodeKind.FILE;
    }

    /** True only when confirmed; use {@link #kind()} to tell "a file" from "nothing there". */
    public boolean isFolder() {
        return kind() == NodeKind.FOLDER;
    }

    public boolean exists() {
        return stat().isPresent();
    }

    /** Size in bytes, -1 when absent. */
    public long size() {
        return stat().map(BasicFileAttributes::size).orElse(-1L);
    }

    /**
     * The containing folder, looked up through the cache and remembered.
     *
     * @throws UnsupportedParentException for a filesystem or drive root
     */
    public FsNode parent() {
        if (parent == null) {
            String parentPath = parentPathOf(path);
            if (parentPath == null) {
                throw new UnsupportedParentException(path);
            }
            parent = owner.getOrCreate(parentPath);
        }
        return parent;
    }

    // ----------------- navigation -----------------

    /** Node for {@code path/suffix}; {@code suffix} may span several segments. */
    public FsNode nested(String suffix) {
        return owner.resolve(path + "/" + suffix);
    }

    /**
     * Node for a direct child, whether or not it exists. Empty when this node is a file
     * (raises in strict mode).
     */
    public Optional<FsNode> descend(String name) {
        if (!checkDescend(kind())) return Optional.empty();
        return Optional.of(child(name));
    }

    public List<FsNode> listChildren() {
        if (!checkListable(kind())) return List.of();
        cachedChildren = ttl().get(cachedChildren, this::listNow, options().childrenMaxAge());
        return childrenValue();
    }

    public List<FsNode> listChildren(Predicate<? super FsNode> filter) {
        List<FsNode> list = listChildren();
        if (filter == null) return list;
        return list.stream().filter(filter).toList();
    }

    public List<FsNode> listFiles() {
        return listChildren(FsNode::isFile);
    }

    public List<FsNode> listFolders() {
        return listChildren(FsNode::isFolder);
    }

    /**
     * The parent's other children.
     *
     * @throws NodeInvariantException in strict mode, when this existing node is missing from its
     *                                parent's listing
     */
    public List<FsNode> siblings() {
        FsNode p = parent();
        if (!p.checkListable(p.kind())) return List.of();
        List<FsNode> list = p.listChildren();
        NodeKind k = kind();
        if (k != NodeKind.ABSENT && !isAmong(list)) {
            // the listing may predate this entry
            p.invalidate();
            list = p.listChildren();
        }
        checkSelfAmong(k, list);
        return list.stream().filter(n -> n != this).toList();
    }

    // ----------------- contents -----------------

    /**
     * File contents (a copy), empty for anything but a readable file.
     */
    public Optional<byte[]> readBytes() {
        if (!checkReadable(kind())) return Optional.empty();
        cachedData = ttl().get(cachedData, this::readNow, options().dataMaxAge());
        return dataValue();
    }

    public Optional<String> readText() {
        return readBytes().map(b -> new String(b, StandardCharsets.UTF_8));
    }

    // ----------------- mutations -----------------

    /**
     * Makes sure this node is a folder, creating missing ancestors in the same call.
     *
     * @throws StructuralConflictException when a file occupies the path
     * @throws FsOperationException        when the folder could not be created, in every mode
     */
    public FsNode createDirectory() {
        if (checkCreateDirectory(kind())) return this;
        logger.debug("Creating folder {}", path);
        Attempt<Void> a = RetryingOperation.attempt(() -> operations().createDirectories(file));
        afterRequiredMutation(a, "create folder");
        return this;
    }

    /**
     * Makes sure the child folder {@code name} exists and returns it.
     *
     * @throws InvalidArgumentsException when {@code name} is empty or not a single segment
     */
    public FsNode createDirectory(String name) {
        checkChildName(name);
        checkCreateInside(kind());
        FsNode target = child(name);
        if (target.checkCreateDirectory(target.kind())) return target;
        return target.createDirectory();
    }

    public boolean writeBytes(byte[] data) {
        return writeBytes(data, false);
    }

    /**
     * Writes {@code data}, creating missing parent folders first.
     *
     * @param overwrite when false an existing file is a {@link StructuralConflictException}
     * @return whether the write went through (strict mode raises instead of returning false)
     */
    public boolean writeBytes(byte[] data, boolean overwrite) {
        requireNonNull(data, "data");
        checkWrite(kind(), overwrite);
        if (!ensureParentFolder()) return false;
        logger.debug("Writing {} to {}", FileUtils.byteCountToDisplaySize(data.length), path);
        Attempt<Void> a = RetryingOperation.attempt(() -> operations().write(file, data));
        return afterMutation(a, "write");
    }

    public boolean appendBytes(byte[] data) {
        return appendBytes(data, false);
    }

    /**
     * @param mustExist when true the node has to be an existing file
     */
    public boolean appendBytes(byte[] data, boolean mustExist) {
        requireNonNull(data, "data");
        checkAppend(kind(), mustExist);
        if (!ensureParentFolder()) return false;
        logger.debug("Appending {} to {}", FileUtils.byteCountToDisplaySize(data.length), path);
        Attempt<Void> a = RetryingOperation.attempt(() -> operations().append(file, data));
        return afterMutation(a, "append");
    }

    /**
     * Replaces the contents of an existing file.
     *
     * @throws StructuralConflictException when there is no file to replace
     */
    public boolean overwrite(byte[] data) {
        checkOverwrite(kind());
        return writeBytes(data, true);
    }

    /** Writes any payload {@link ContentEncoder} understands. */
    public boolean write(Object value, boolean overwrite) {
        return writeBytes(ContentEncoder.toBytes(value), overwrite);
    }

    public boolean append(Object value) {
        return appendBytes(ContentEncoder.toBytes(value), false);
    }

    /** Drops the cached stat, listing and contents. */
    public void invalidate() {
        cachedStat = null;
        cachedChildren = null;
        cachedData = null;
    }

    // ----------------- shared with AsyncFsNode -----------------

    FsOptions options() { return owner.options(); }
    FsOperations operations() { return owner.operations(); }
    TtlCache ttl() { return owner.ttl(); }
    NodeCache owner() { return owner; }

    boolean strict() {
        return options().mode().isStrict();
    }

    FsNode child(String name) {
        return owner.resolve(path + "/" + name);
    }

    boolean hasParent() {
        return parentPathOf(path) != null;
    }

    Optional<BasicFileAttributes> freshStat() {
        return isFresh(cachedStat, options().statMaxAge()) ? cachedStat.value() : null;
    }

    Optional<BasicFileAttributes> storeStat(Attempt<BasicFileAttributes> a) {
        try {
            cachedStat = ttl().stamp(statOf(a));
        } catch (FsOperationException e) {
            cachedStat = ttl().stampError(e);
        }
        return statValue();
    }

    List<FsNode> freshChildren() {
        return isFresh(cachedChildren, options().childrenMaxAge()) ? cachedChildren.value() : null;
    }

    List<FsNode> storeChildren(Attempt<List<String>> a) {
        try {
            cachedChildren = ttl().stamp(childrenOf(a));
        } catch (FsOperationException e) {
            cachedChildren = ttl().stampError(e);
        }
        return childrenValue();
    }

    Optional<byte[]> freshData() {
        return isFresh(cachedData, options().dataMaxAge()) ? dataValue() : null;
    }

    Optional<byte[]> storeData(Attempt<byte[]> a) {
        try {
            cachedData = ttl().stamp(dataOf(a));
        } catch (FsOperationException e) {
            cachedData = ttl().stampError(e);
        }
        return dataValue();
    }

    /** @return true when the folder already exists and nothing is left to do */
    boolean checkCreateDirectory(NodeKind kind) {
        if (kind == NodeKind.FOLDER) return true;
        if (kind == NodeKind.FILE) {
            throw new StructuralConflictException("Cannot create folder on an existing file", path);
        }
        return false;
    }

    void checkCreateInside(NodeKind kind) {
        if (kind == NodeKind.FILE) {
            throw new StructuralConflictException("Cannot create folder inside an existing file", path);
        }
    }

    static void checkChildName(String name) {
        if (StringUtils.isEmpty(name) || StringUtils.containsAny(name, '/', '\\')
                || name.equals(".") || name.equals("..")) {
            throw new InvalidArgumentsException("Cannot create child folder with name " + name);
        }
    }

    boolean checkListable(NodeKind kind) {
        if (kind == NodeKind.FOLDER) return true;
        if (strict()) {
            throw new StructuralConflictException("Cannot get children of non-folder", path);
        }
        return false;
    }

    boolean checkReadable(NodeKind kind) {
        if (kind == NodeKind.FILE) return true;
        if (strict()) {
            throw new StructuralConflictException("Cannot get data of non-file", path);
        }
        return false;
    }

    boolean checkDescend(NodeKind kind) {
        if (kind != NodeKind.FILE) return true;
        if (strict()) {
            throw new StructuralConflictException("Cannot target child inside existing file", path);
        }
        return false;
    }

    void checkWrite(NodeKind kind, boolean overwrite) {
        if (!overwrite && kind == NodeKind.FILE) {
            throw new StructuralConflictException("Write target already exists (overwrite disabled)", path);
        }
        checkNotFolder(kind, "write");
    }

    void checkAppend(NodeKind kind, boolean mustExist) {
        if (mustExist && kind != NodeKind.FILE) {
            throw new StructuralConflictException("Append target does not exist", path);
        }
        checkNotFolder(kind, "append");
    }

    void checkNotFolder(NodeKind kind, String action) {
        if (kind != NodeKind.FOLDER) return;
        if (strict()) {
            throw new StructuralConflictException("Cannot " + action + " onto an existing folder", path);
        }
        logger.warn("Attempting to {} onto an existing folder at {}", action, path);
    }

    void checkOverwrite(NodeKind kind) {
        if (kind != NodeKind.FILE) {
            throw new StructuralConflictException("Rewrite target does not exist", path);
        }
    }

    /** @return true when the parent folder still has to be created */
    boolean checkParentForWrite(FsNode p, NodeKind parentKind) {
        if (parentKind == NodeKind.FILE) {
            throw new StructuralConflictException("Cannot write inside an existing file", p.path());
        }
        return parentKind == NodeKind.ABSENT;
    }

    boolean isAmong(List<FsNode> nodes) {
        return nodes.stream().anyMatch(n -> n == this);
    }

    void checkSelfAmong(NodeKind kind, List<FsNode> siblingsAndSelf) {
        if (kind == NodeKind.ABSENT) return;
        if (isAmong(siblingsAndSelf)) return;
        String msg = "Node " + path + " missing from the children of " + parent().path();
        if (strict()) {
            throw new NodeInvariantException(msg);
        }
        logger.warn(msg);
    }

    /**
     * Invalidates after a successful mutation, otherwise surfaces (strict) or logs the failure.
     *
     * @return whether the mutation succeeded
     */
    boolean afterMutation(Attempt<?> a, String action) {
        if (a.ok()) {
            invalidateLineage();
            return true;
        }
        var failure = new FsOperationException(a.code(), "Failed to " + action + " at " + path, a.error());
        if (strict()) {
            throw failure;
        }
        logger.warn("{}: {}", failure.getMessage(), a.error().toString());
        return false;
    }

    /**
     * Like {@link #afterMutation} for mutations whose caller gets a node back: a failure raises
     * whatever the mode.
     */
    void afterRequiredMutation(Attempt<?> a, String action) {
        if (!a.ok()) {
            throw new FsOperationException(a.code(), "Failed to " + action + " at " + path, a.error());
        }
        invalidateLineage();
    }

    /**
     * Outcome of a failed parent-folder creation before a write: false with a warning, or the
     * error itself in strict mode and for anything but an I/O failure.
     */
    boolean parentFolderFailed(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (strict() || !(cause instanceof FsOperationException)) {
            if (cause instanceof RuntimeException re) throw re;
            throw new CompletionException(cause);
        }
        logger.warn("Cannot write {}: {}", path, cause.getMessage());
        return false;
    }

    // ----------------- internals -----------------

    /** @return false when the missing parent folder could not be created */
    private boolean ensureParentFolder() {
        if (!hasParent()) return true;
        FsNode p = parent();
        if (!checkParentForWrite(p, p.kind())) return true;
        try {
            p.createDirectory();
            return true;
        } catch (FsOperationException e) {
            return parentFolderFailed(e);
        }
    }

    /**
     * Drops this node's caches and those of every cached ancestor: creating an entry changes the
     * listing of its parent and may have created the ancestors themselves.
     */
    private void invalidateLineage() {
        invalidate();
        String current = parentPathOf(path);
        while (current != null) {
            owner.find(current).ifPresent(FsNode::invalidate);
            current = parentPathOf(current);
        }
    }

    /**
     * Canonical parent path, or null for a root. Paths of one or two segments go through the
     * absolute form so that "./x", "." and "/x" all land on a real directory.
     */
    private String parentPathOf(String p) {
        PathResolver resolver = owner.resolver();
        String[] segments = p.split("/", -1);
        if (segments.length <= 2) {
            String abs = resolver.absolute(p);
            if (PathResolver.isRoot(abs)) return null;
            return resolver.canonicalize(PathResolver.directoryOf(abs));
        }
        return resolver.canonicalize(String.join("/", Arrays.copyOf(segments, segments.length - 1)));
    }

    private boolean isFresh(CacheEntry<?> entry, Duration maxAge) {
        return entry != null && !entry.failed() && ttl().isFresh(entry, maxAge);
    }

    private Optional<BasicFileAttributes> statNow() {
        return statOf(RetryingOperation.attempt(null, () -> operations().stat(file)));
    }

    private List<FsNode> listNow() {
        return childrenOf(RetryingOperation.attempt(List.of(), () -> operations().list(file)));
    }

    private byte[] readNow() {
        return dataOf(RetryingOperation.attempt(null, () -> operations().read(file)));
    }

    private Optional<BasicFileAttributes> statOf(Attempt<BasicFileAttributes> a) {
        if (a.ok()) return Optional.ofNullable(a.data());
        IoErrorCode code = a.code();
        if (code == IoErrorCode.NOT_FOUND || code == IoErrorCode.NOT_DIRECTORY) {
            return Optional.empty();
        }
        throw new FsOperationException(code, "Failed to stat " + path, a.error());
    }

    private List<FsNode> childrenOf(Attempt<List<String>> a) {
        if (!a.ok()) {
            throw new FsOperationException(a.code(), "Failed to list " + path, a.error());
        }
        if (a.data() == null) return List.of();
        return a.data().stream().map(this::child).toList();
    }

    private byte[] dataOf(Attempt<byte[]> a) {
        if (!a.ok()) {
            throw new FsOperationException(a.code(), "Failed to read " + path, a.error());
        }
        if (a.data() == null) {
            throw new FsOperationException(IoErrorCode.IO, "Invalid read result at " + path);
        }
        return a.data();
    }

    private Optional<BasicFileAttributes> statValue() {
        if (cachedStat.failed()) {
            logger.debug("stat unavailable at {}: {}", path, cachedStat.error().getMessage());
            return Optional.empty();
        }
        return cachedStat.value();
    }

    private List<FsNode> childrenValue() {
        if (cachedChildren.failed()) {
            logger.debug("listing unavailable at {}: {}", path, cachedChildren.error().getMessage());
            return List.of();
        }
        return cachedChildren.value();
    }

    private Optional<byte[]> dataValue() {
        if (cachedData.failed()) {
            Throwable error = cachedData.error();
            if (strict()) {
                throw error instanceof FsOperationException foe
                        ? foe
                        : new FsOperationException(IoErrorCode.classify(error), "Failed to read " + path, error);
            }
            logger.warn("Cannot read {}: {}", path, error.getMessage());
            return Optional.empty();
        }
        return Optional.of(cachedData.value().clone());
    }
}
