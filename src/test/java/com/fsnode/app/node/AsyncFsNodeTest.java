package com.fsnode.app.node;

import com.fsnode.app.cache.MutableClock;
import com.fsnode.app.cache.TtlCache;
import com.fsnode.app.config.FsOptions;
import com.fsnode.app.config.OperationMode;
import com.fsnode.app.exception.FsOperationException;
import com.fsnode.app.exception.InvalidArgumentsException;
import com.fsnode.app.exception.StructuralConflictException;
import com.fsnode.app.io.IoErrorCode;
import com.fsnode.app.path.PathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AsyncFsNodeTest {

    private Path root;
    private CountingFsOperations ops;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("fsnode-async-");
        ops = new CountingFsOperations();
    }

    private FileNodes nodes(OperationMode mode) {
        return new FileNodes(FsOptions.defaults().withMode(mode), ops, root::toString, new MutableClock());
    }

    private static List<String> names(List<AsyncFsNode> list) {
        return list.stream().map(n -> n.node().name()).toList();
    }

    @Test
    void writeThenReadThroughTheExecutor() {
        AsyncFsNode f = nodes(OperationMode.NORMAL).async("out", "a.txt");

        assertTrue(f.write("hello", false).join());
        assertEquals("hello", f.readText().join().orElseThrow());
        assertTrue(Files.isDirectory(root.resolve("out")), "Parent folder is created on write");
        assertEquals(5L, f.size().join());
    }

    @Test
    void sharesCachedStateWithTheBlockingNode() throws Exception {
        Files.writeString(root.resolve("s.txt"), "x");
        FsNode s = nodes(OperationMode.NORMAL).of("s.txt");

        assertTrue(s.isFile());
        assertEquals(NodeKind.FILE, s.async().kind().join());
        assertEquals(1, ops.count("stat"), "Async view must reuse the fresh stat");
    }

    @Test
    void conflictsCompleteExceptionally() throws Exception {
        Files.writeString(root.resolve("f"), "x");
        FileNodes fs = nodes(OperationMode.NORMAL);

        CompletionException clobber = assertThrows(CompletionException.class,
                () -> fs.async("f").writeBytes("y".getBytes(StandardCharsets.UTF_8)).join());
        assertInstanceOf(StructuralConflictException.class, clobber.getCause());

        CompletionException badName = assertThrows(CompletionException.class,
                () -> fs.async(".").createDirectory("a/b").join());
        assertInstanceOf(InvalidArgumentsException.class, badName.getCause());

        CompletionException listing = assertThrows(CompletionException.class,
                () -> nodes(OperationMode.STRICT).async("f").listChildren().join());
        assertInstanceOf(StructuralConflictException.class, listing.getCause());
    }

    @Test
    void createDirectoryIsIdempotent() {
        AsyncFsNode parent = nodes(OperationMode.NORMAL).async("p");

        AsyncFsNode child = parent.createDirectory("c").join();
        assertSame(child, parent.createDirectory("c").join());

        assertTrue(Files.isDirectory(root.resolve("p/c")));
        assertEquals(1, ops.count("createDirectories"));
    }

    @Test
    void asyncFilterRunsSequentiallyInListOrder() throws Exception {
        Path dir = Files.createDirectory(root.resolve("dir"));
        for (String n : List.of("c.txt", "a.txt", "b.log")) {
            Files.writeString(dir.resolve(n), n);
        }
        Files.createDirectory(dir.resolve("sub"));
        AsyncFsNode d = nodes(OperationMode.NORMAL).async("dir");

        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<AsyncFsNode> txt = d.listChildren((n, i, all) -> {
            seen.add(i);
            assertEquals(4, all.size());
            return CompletableFuture.supplyAsync(() -> n.node().name().endsWith(".txt"));
        }).join();

        assertEquals(List.of("a.txt", "c.txt"), names(txt));
        assertEquals(List.of(0, 1, 2, 3), seen);
        assertEquals(List.of("a.txt", "b.log", "c.txt"), names(d.listFiles().join()));
        assertEquals(List.of("sub"), names(d.listFolders().join()));
    }

    @Test
    void siblingsAndDescend() throws Exception {
        Path dir = Files.createDirectory(root.resolve("dir"));
        Files.writeString(dir.resolve("a"), "a");
        Files.writeString(dir.resolve("b"), "b");
        FileNodes fs = nodes(OperationMode.STRICT);

        assertEquals(List.of("b"), names(fs.async("dir/a").siblings().join()));
        assertSame(fs.async("dir/a"), fs.async("dir").descend("a").join().orElseThrow());
        assertSame(fs.async("dir"), fs.async("dir/a").parent());
    }

    @Test
    void failedFolderCreationCompletesExceptionally() {
        ops.failNext("createDirectories", new AccessDeniedException("d"));

        CompletionException e = assertThrows(CompletionException.class,
                () -> nodes(OperationMode.FORGIVING).async(".").createDirectory("d").join());

        FsOperationException cause = assertInstanceOf(FsOperationException.class, e.getCause());
        assertEquals(IoErrorCode.ACCESS_DENIED, cause.getCode());
        assertFalse(Files.exists(root.resolve("d")));
    }

    @Test
    void writeReportsFalseWhenTheParentFolderCannotBeCreated() {
        ops.failNext("createDirectories", new AccessDeniedException("p"));

        assertFalse(nodes(OperationMode.NORMAL).async("p", "f.txt").writeBytes(new byte[] { 1 }).join());
        assertEquals(0, ops.count("write"));
    }

    @Test
    void siblingsRelistWhenTheCachedListingPredatesTheNode() throws Exception {
        Path dir = Files.createDirectory(root.resolve("dir"));
        Files.writeString(dir.resolve("b"), "b");
        FileNodes fs = nodes(OperationMode.STRICT);

        assertEquals(List.of("b"), names(fs.async("dir").listChildren().join()));
        Files.writeString(dir.resolve("a"), "a");

        assertEquals(List.of("b"), names(fs.async("dir/a").siblings().join()));
    }

    @Test
    void writeUsesTheBytesGivenAtCallTime() throws Exception {
        BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();
        NodeCache cache = new NodeCache(FsOptions.defaults(), new PathResolver(root::toString), ops,
                new TtlCache(new MutableClock()), tasks::add);
        byte[] data = "keep".getBytes(StandardCharsets.UTF_8);

        CompletableFuture<Boolean> written = cache.getOrCreate("./k.txt").async().writeBytes(data);
        data[0] = 'X';

        while (!written.isDone()) {
            Runnable task = tasks.poll(5, TimeUnit.SECONDS);
            assertNotNull(task, "write stalled");
            task.run();
        }
        assertTrue(written.join());
        assertEquals("keep", Files.readString(root.resolve("k.txt")));
    }

    @Test
    void appendAndOverwrite() {
        AsyncFsNode log = nodes(OperationMode.NORMAL).async("log.txt");

        assertTrue(log.append("a").join());
        assertTrue(log.appendBytes("b".getBytes(StandardCharsets.UTF_8), true).join());
        assertEquals("ab", log.readText().join().orElseThrow());

        assertTrue(log.overwrite("z".getBytes(StandardCharsets.UTF_8)).join());
        assertEquals("z", log.readText().join().orElseThrow());
    }
}
