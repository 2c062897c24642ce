package com.fsnode.app.node;

import com.fsnode.app.cache.TtlCache;
import com.fsnode.app.config.FsOptions;
import com.fsnode.app.exception.InvalidArgumentsException;
import com.fsnode.app.io.FsOperations;
import com.fsnode.app.io.NioFsOperations;
import com.fsnode.app.path.PathResolver;
import com.fsnode.app.path.ResolvedPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Entry point: turns loose arguments into cached nodes.
 *
 * <pre>{@code
 * FileNodes fs = new FileNodes();
 * FsNode report = fs.of("out", "reports", "today.txt");
 * report.write("done", true);
 * }</pre>
 */
public final class FileNodes {

    private static final Logger logger = LoggerFactory.getLogger(FileNodes.class);

    private static volatile FileNodes shared;

    private final FsOptions options;
    private final NodeCache cache;

    public FileNodes() {
        this(FsOptions.load());
    }

    public FileNodes(FsOptions options) {
        this(options, new NioFsOperations(), () -> System.getProperty("user.dir"), Clock.systemUTC());
    }

    public FileNodes(FsOptions options, FsOperations operations, Supplier<String> workingDirectory, Clock clock) {
        this.options = options;
        this.cache = new NodeCache(options, new PathResolver(workingDirectory), operations,
                new TtlCache(clock), NodeCache.defaultExecutor());
    }

    /** Process-wide instance, configured from application.conf and FSNODE_MODE on first use. */
    public static FileNodes shared() {
        FileNodes local = shared;
        if (local == null) {
            synchronized (FileNodes.class) {
                local = shared;
                if (local == null) {
                    local = new FileNodes(FsOptions.load());
                    logger.info("Using mode {}", local.options.mode());
                    shared = local;
                }
            }
        }
        return local;
    }

    /**
     * Node for the path built from {@code args}.
     *
     * @throws InvalidArgumentsException when some argument is unusable, unless the mode is forgiving
     */
    public FsNode of(Object... args) {
        ResolvedPath resolved = cache.resolver().resolve(args);
        if (resolved.hasProblems()) {
            if (options.mode().raisesOnProblems()) {
                throw new InvalidArgumentsException(resolved.problems());
            }
            logger.warn("Ignoring invalid arguments {} for {}",
                    InvalidArgumentsException.describe(resolved.problems()), resolved.path());
        }
        return cache.getOrCreate(resolved.path());
    }

    public AsyncFsNode async(Object... args) {
        return of(args).async();
    }

    public NodeCache cache() {
        return cache;
    }

    public PathResolver resolver() {
        return cache.resolver();
    }

    public FsOptions options() {
        return options;
    }

    public void reset() {
        cache.reset();
    }
}
