package com.fsnode.app.node;

import com.fsnode.app.cache.TtlCache;
import com.fsnode.app.config.FsOptions;
import com.fsnode.app.io.FsOperations;
import com.fsnode.app.io.NioFsOperations;
import com.fsnode.app.path.PathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * Registry of nodes keyed by canonical path: one node per path for as long as the cache lives.
 * <p>
 * Nothing is ever evicted; the map grows with every distinct path touched until {@link #reset()}.
 * The collaborators every node needs (options, resolver, OS table, clocked TTL cache, executor
 * for async views) live here and are reached by nodes through their owner.
 */
public final class NodeCache {

    private static final Logger logger = LoggerFactory.getLogger(NodeCache.class);

    private final ConcurrentHashMap<String, FsNode> nodes = new ConcurrentHashMap<>();

    private final FsOptions options;
    private final PathResolver resolver;
    private final FsOperations operations;
    private final TtlCache ttl;
    private final Executor executor;

    public NodeCache(FsOptions options) {
        this(options, new PathResolver(), new NioFsOperations(), new TtlCache(), defaultExecutor());
    }

    public NodeCache(FsOptions options, PathResolver resolver, FsOperations operations, TtlCache ttl, Executor executor) {
        this.options = requireNonNull(options, "options");
        this.resolver = requireNonNull(resolver, "resolver");
        this.operations = requireNonNull(operations, "operations");
        this.ttl = requireNonNull(ttl, "ttl");
        this.executor = requireNonNull(executor, "executor");
    }

    /**
     * The node bound to {@code canonicalPath}, created on first use.
     * The argument must already be canonical ({@link PathResolver#canonicalize(String)}).
     */
    public FsNode getOrCreate(String canonicalPath) {
        requireNonNull(canonicalPath, "canonicalPath");
        return nodes.computeIfAbsent(canonicalPath, p -> {
            logger.debug("Creating node for {}", p);
            return new FsNode(p, this);
        });
    }

    public Optional<FsNode> find(String canonicalPath) {
        return Optional.ofNullable(nodes.get(canonicalPath));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Forgets every node. Nodes handed out before keep working but are no longer the ones
     * returned for their path.
     */
    public void reset() {
        int dropped = nodes.size();
        nodes.clear();
        logger.debug("Node cache reset, {} nodes dropped", dropped);
    }

    FsNode resolve(String rawPath) {
        return getOrCreate(resolver.canonicalize(rawPath));
    }

    public FsOptions options() { return options; }
    public PathResolver resolver() { return resolver; }
    public FsOperations operations() { return operations; }
    public TtlCache ttl() { return ttl; }
    public Executor executor() { return executor; }

    // ----------------- executor -----------------

    private static final class IoExecutorHolder {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        private static final ExecutorService INSTANCE = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "fsnode-io-" + COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Shared daemon pool for the blocking OS calls of async views. */
    public static Executor defaultExecutor() {
        return IoExecutorHolder.INSTANCE;
    }
}
