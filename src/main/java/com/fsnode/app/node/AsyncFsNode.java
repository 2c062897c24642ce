package com.fsnode.app.node;

import com.fsnode.app.exception.FsNodeException;
import com.fsnode.app.io.ContentEncoder;
import com.fsnode.app.io.FsOperations;
import com.fsnode.app.io.RetryingOperation;
import com.fsnode.app.path.PathLike;

import java.nio.charset.StandardCharsets;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static java.util.Objects.requireNonNull;

/**
 * Non-blocking view of an {@link FsNode}. Shares the node's caches and precondition rules; OS
 * calls run on the owning cache's executor and the retry pause is scheduled, not slept.
 * Anything the blocking node would throw arrives as an exceptionally completed future.
 */
public class AsyncFsNode implements PathLike {

    /**
     * Asynchronous predicate over a listing. Called once per child, in order, each call waiting
     * for the previous one to complete.
     */
    @FunctionalInterface
    public interface AsyncFilter {
        CompletionStage<Boolean> test(AsyncFsNode node, int index, List<AsyncFsNode> children);
    }

    private final FsNode node;

    AsyncFsNode(FsNode node) {
        this.node = node;
    }

    /** The blocking node behind this view. */
    public FsNode node() {
        return node;
    }

    @Override
    public String path() {
        return node.path();
    }

    @Override
    public String toString() {
        return node.path();
    }

    public AsyncFsNode parent() {
        return node.parent().async();
    }

    public AsyncFsNode nested(String suffix) {
        return node.nested(suffix).async();
    }

    public void invalidate() {
        node.invalidate();
    }

    // ----------------- metadata -----------------

    public CompletableFuture<Optional<BasicFileAttributes>> stat() {
        Optional<BasicFileAttributes> fresh = node.freshStat();
        if (fresh != null) {
            return CompletableFuture.completedFuture(fresh);
        }
        return RetryingOperation.attemptOn((BasicFileAttributes) null, () -> ops().stat(node.file()), executor())
                .thenApply(node::storeStat);
    }

    public CompletableFuture<NodeKind> kind() {
        return stat().thenApply(s -> NodeKind.of(s.orElse(null)));
    }

    public CompletableFuture<Boolean> exists() {
        return stat().thenApply(Optional::isPresent);
    }

    public CompletableFuture<Long> size() {
        return stat().thenApply(s -> s.map(BasicFileAttributes::size).orElse(-1L));
    }

    // ----------------- navigation -----------------

    public CompletableFuture<Optional<AsyncFsNode>> descend(String name) {
        return kind().thenApply(k -> {
            if (!node.checkDescend(k)) return Optional.<AsyncFsNode>empty();
            return Optional.of(node.child(name).async());
        });
    }

    public CompletableFuture<List<AsyncFsNode>> listChildren() {
        return kind().thenCompose(k -> {
            if (!node.checkListable(k)) {
                return CompletableFuture.completedFuture(List.<AsyncFsNode>of());
            }
            return loadChildren();
        });
    }

    public CompletableFuture<List<AsyncFsNode>> listChildren(AsyncFilter filter) {
        return listChildren().thenCompose(children -> {
            if (filter == null) {
                return CompletableFuture.completedFuture(children);
            }
            List<AsyncFsNode> kept = new ArrayList<>();
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (int i = 0; i < children.size(); i++) {
                int index = i;
                AsyncFsNode child = children.get(i);
                chain = chain.thenCompose(v -> filter.test(child, index, children))
                        .thenAccept(keep -> {
                            if (Boolean.TRUE.equals(keep)) kept.add(child);
                        });
            }
            return chain.thenApply(v -> List.copyOf(kept));
        });
    }

    public CompletableFuture<List<AsyncFsNode>> listFiles() {
        return listChildren((n, i, all) -> n.kind().thenApply(k -> k == NodeKind.FILE));
    }

    public CompletableFuture<List<AsyncFsNode>> listFolders() {
        return listChildren((n, i, all) -> n.kind().thenApply(k -> k == NodeKind.FOLDER));
    }

    public CompletableFuture<List<AsyncFsNode>> siblings() {
        AsyncFsNode p;
        try {
            p = parent();
        } catch (FsNodeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return p.kind().thenCompose(pk -> {
            if (!p.node.checkListable(pk)) {
                return CompletableFuture.completedFuture(List.<AsyncFsNode>of());
            }
            return kind().thenCompose(k -> p.listChildren()
                    .thenCompose(list -> {
                        if (k == NodeKind.ABSENT || node.isAmong(nodes(list))) {
                            return CompletableFuture.completedFuture(list);
                        }
                        // the listing may predate this entry
                        p.invalidate();
                        return p.listChildren();
                    })
                    .thenApply(list -> {
                        node.checkSelfAmong(k, nodes(list));
                        return list.stream().filter(n -> n != this).toList();
                    }));
        });
    }

    // ----------------- contents -----------------

    public CompletableFuture<Optional<byte[]>> readBytes() {
        return kind().thenCompose(k -> {
            if (!node.checkReadable(k)) {
                return CompletableFuture.completedFuture(Optional.<byte[]>empty());
            }
            Optional<byte[]> fresh = node.freshData();
            if (fresh != null) {
                return CompletableFuture.completedFuture(fresh);
            }
            return RetryingOperation.attemptOn((byte[]) null, () -> ops().read(node.file()), executor())
                    .thenApply(node::storeData);
        });
    }

    public CompletableFuture<Optional<String>> readText() {
        return readBytes().thenApply(b -> b.map(bytes -> new String(bytes, StandardCharsets.UTF_8)));
    }

    // ----------------- mutations -----------------

    public CompletableFuture<AsyncFsNode> createDirectory() {
        return kind().thenCompose(k -> {
            if (node.checkCreateDirectory(k)) {
                return CompletableFuture.completedFuture(this);
            }
            return RetryingOperation.attemptOn(() -> ops().createDirectories(node.file()), executor())
                    .thenApply(a -> {
                        node.afterRequiredMutation(a, "create folder");
                        return this;
                    });
        });
    }

    public CompletableFuture<AsyncFsNode> createDirectory(String name) {
        try {
            FsNode.checkChildName(name);
        } catch (FsNodeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return kind().thenCompose(k -> {
            node.checkCreateInside(k);
            return node.child(name).async().createDirectory();
        });
    }

    public CompletableFuture<Boolean> writeBytes(byte[] data) {
        return writeBytes(data, false);
    }

    /** {@code data} is copied before the call returns. */
    public CompletableFuture<Boolean> writeBytes(byte[] data, boolean overwrite) {
        byte[] bytes = requireNonNull(data, "data").clone();
        return kind()
                .thenCompose(k -> {
                    node.checkWrite(k, overwrite);
                    return ensureParentFolder();
                })
                .thenCompose(ready -> {
                    if (!ready) return CompletableFuture.<Boolean>completedFuture(false);
                    return RetryingOperation.attemptOn(() -> ops().write(node.file(), bytes), executor())
                            .thenApply(a -> node.afterMutation(a, "write"));
                });
    }

    public CompletableFuture<Boolean> appendBytes(byte[] data) {
        return appendBytes(data, false);
    }

    /** {@code data} is copied before the call returns. */
    public CompletableFuture<Boolean> appendBytes(byte[] data, boolean mustExist) {
        byte[] bytes = requireNonNull(data, "data").clone();
        return kind()
                .thenCompose(k -> {
                    node.checkAppend(k, mustExist);
                    return ensureParentFolder();
                })
                .thenCompose(ready -> {
                    if (!ready) return CompletableFuture.<Boolean>completedFuture(false);
                    return RetryingOperation.attemptOn(() -> ops().append(node.file(), bytes), executor())
                            .thenApply(a -> node.afterMutation(a, "append"));
                });
    }

    public CompletableFuture<Boolean> overwrite(byte[] data) {
        byte[] bytes = requireNonNull(data, "data").clone();
        return kind().thenCompose(k -> {
            node.checkOverwrite(k);
            return writeBytes(bytes, true);
        });
    }

    /** Encoding happens on the calling thread; an unencodable value throws right away. */
    public CompletableFuture<Boolean> write(Object value, boolean overwrite) {
        return writeBytes(ContentEncoder.toBytes(value), overwrite);
    }

    public CompletableFuture<Boolean> append(Object value) {
        return appendBytes(ContentEncoder.toBytes(value), false);
    }

    // ----------------- internals -----------------

    /** Completes with false when the missing parent folder could not be created. */
    private CompletableFuture<Boolean> ensureParentFolder() {
        if (!node.hasParent()) {
            return CompletableFuture.completedFuture(true);
        }
        AsyncFsNode p = parent();
        return p.kind().thenCompose(pk -> {
            if (!node.checkParentForWrite(p.node, pk)) {
                return CompletableFuture.completedFuture(true);
            }
            return p.createDirectory().handle((created, err) -> err == null || node.parentFolderFailed(err));
        });
    }

    private static List<FsNode> nodes(List<AsyncFsNode> views) {
        return views.stream().map(AsyncFsNode::node).toList();
    }

    private CompletableFuture<List<AsyncFsNode>> loadChildren() {
        List<FsNode> fresh = node.freshChildren();
        CompletableFuture<List<FsNode>> nodes;
        if (fresh != null) {
            nodes = CompletableFuture.completedFuture(fresh);
        } else {
            nodes = RetryingOperation.attemptOn(List.<String>of(), () -> ops().list(node.file()), executor())
                    .thenApply(node::storeChildren);
        }
        return nodes.thenApply(list -> list.stream().map(FsNode::async).toList());
    }

    private FsOperations ops() {
        return node.operations();
    }

    private Executor executor() {
        return node.owner().executor();
    }
}
