package com.fsnode.app.path;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Builds canonical paths out of loosely typed call arguments.
 * <p>
 * Strings and numbers become segments, arrays and iterables are flattened, objects contribute
 * the first non-empty value among {@link #PATH_KEYS}. Whatever cannot be interpreted is reported
 * as an {@link ArgumentProblem}; the resolver never throws for bad input.
 * <p>
 * A canonical path uses forward slashes only, has no repeated or trailing slash, no {@code ?},
 * no {@code .}/{@code ..} segments, and is written relative to the working directory
 * ({@code .} or {@code ./rest}) when it lies under it, absolute otherwise.
 */
public final class PathResolver {

    private static final Logger logger = LoggerFactory.getLogger(PathResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Object keys probed for a path, in priority order. */
    public static final List<String> PATH_KEYS = List.of(
            "name", "path", "filePath", "filepath", "file_path", "fullPath", "fullpath", "full_path");

    private static final String INVALID_CHARS = "\"<>*";
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:(/|$)");
    private static final Pattern DRIVE_ROOT = Pattern.compile("^[A-Za-z]:/?$");

    private final Supplier<String> workingDirectory;

    public PathResolver() {
        this(() -> System.getProperty("user.dir"));
    }

    public PathResolver(Supplier<String> workingDirectory) {
        this.workingDirectory = requireNonNull(workingDirectory, "workingDirectory");
    }

    // ----------------- resolve -----------------

    public ResolvedPath resolve(Object... args) {
        Object[] safeArgs = args == null ? new Object[] { null } : args;
        List<Object> relevant = isIterationCallback(safeArgs)
                ? new ArrayList<>(List.of(safeArgs[0]))
                : new ArrayList<>(Arrays.asList(safeArgs));

        List<String> parts = new ArrayList<>();
        List<ArgumentProblem> problems = new ArrayList<>();

        // relevant grows while flattening, so the bound is re-read on every pass
        for (int i = 0; i < relevant.size(); i++) {
            Object a = relevant.get(i);
            if (a == null) continue;

            if (parts.isEmpty() && a instanceof String s && s.isEmpty()) {
                parts.add(".");
                continue;
            }
            if (a instanceof CharSequence || a instanceof Number) {
                addSegment(a.toString(), i, a, parts, problems);
                continue;
            }
            if (a instanceof PathLike p) {
                addSegment(p.path(), i, a, parts, problems);
                continue;
            }
            if (a instanceof Path p) {
                addSegment(p.toString(), i, a, parts, problems);
                continue;
            }
            if (a instanceof File f) {
                addSegment(f.getPath(), i, a, parts, problems);
                continue;
            }
            if (a instanceof Object[] arr) {
                relevant.addAll(Arrays.asList(arr));
                continue;
            }
            if (a instanceof Iterable<?> it) {
                it.forEach(relevant::add);
                continue;
            }
            String keyed = keyedPath(a);
            if (keyed != null) {
                addSegment(keyed, i, a, parts, problems);
                continue;
            }
            problems.add(new ArgumentProblem(i, a));
        }

        return new ResolvedPath(canonicalize(String.join("/", parts)), problems);
    }

    /**
     * Canonical form of a single raw path string. Idempotent.
     */
    public String canonicalize(String raw) {
        String cwd = workingDirectory();
        return relativize(absoluteOf(normalize(raw == null ? "" : raw), cwd), cwd);
    }

    /**
     * Absolute form of a (canonical or raw) path, without the working-directory shorthand.
     */
    public String absolute(String path) {
        return absoluteOf(normalize(path == null ? "" : path), workingDirectory());
    }

    /**
     * Directory part of an absolute path; the root of a root.
     */
    public static String directoryOf(String absolutePath) {
        int idx = absolutePath.lastIndexOf('/');
        if (idx < 0) return absolutePath;
        if (idx == absolutePath.length() - 1) return absolutePath;
        String dir = absolutePath.substring(0, idx);
        if (dir.isEmpty()) return "/";
        if (DRIVE_ROOT.matcher(dir).matches()) return StringUtils.appendIfMissing(dir, "/");
        return dir;
    }

    public static boolean isRoot(String absolutePath) {
        return "/".equals(absolutePath) || DRIVE_ROOT.matcher(absolutePath).matches();
    }

    // ----------------- helpers -----------------

    /**
     * A call shaped like {@code (value, index, list)} where {@code list[index]} is {@code value}
     * comes from iterating a list; only the value is a path.
     */
    static boolean isIterationCallback(Object[] args) {
        if (args.length != 3 || !(args[1] instanceof Number n)) return false;
        double d = n.doubleValue();
        if (d != Math.rint(d) || d < 0) return false;
        int index = (int) d;

        Object element;
        if (args[2] instanceof List<?> list) {
            if (index >= list.size()) return false;
            element = list.get(index);
        } else if (args[2] instanceof Object[] arr) {
            if (index >= arr.length) return false;
            element = arr[index];
        } else {
            return false;
        }

        if (element == args[0]) return true;
        if (element == null || args[0] == null) return false;
        boolean scalar = element instanceof CharSequence || element instanceof Number;
        return scalar && element.toString().equals(String.valueOf(args[0]))
                && element.getClass() == args[0].getClass();
    }

    private static void addSegment(String segment, int index, Object source,
                                   List<String> parts, List<ArgumentProblem> problems) {
        if (StringUtils.containsAny(segment, INVALID_CHARS)) {
            problems.add(new ArgumentProblem(index, source));
            return;
        }
        parts.add(segment);
    }

    private static String keyedPath(Object a) {
        if (a instanceof Boolean || a instanceof Character || a instanceof Enum<?> || a.getClass().isArray()) {
            return null;
        }
        Map<?, ?> props;
        if (a instanceof Map<?, ?> m) {
            props = m;
        } else {
            try {
                props = MAPPER.convertValue(a, Map.class);
            } catch (IllegalArgumentException e) {
                logger.debug("Cannot inspect {} for a path: {}", a.getClass().getName(), e.getMessage());
                return null;
            }
        }
        if (props == null || props.isEmpty()) return null;
        for (String key : PATH_KEYS) {
            if (props.get(key) instanceof String s && !s.isEmpty()) {
                return s;
            }
        }
        return null;
    }

    static String normalize(String raw) {
        String p = raw.replace('\\', '/');
        p = REPEATED_SLASHES.matcher(p).replaceAll("/");
        p = StringUtils.remove(p, '?');
        // "/" stays the root
        if (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private String workingDirectory() {
        String cwd = workingDirectory.get();
        if (StringUtils.isBlank(cwd)) {
            throw new IllegalStateException("Working directory is not available");
        }
        return absoluteOf(normalize(cwd.trim()), "/");
    }

    private static boolean isAbsolute(String p) {
        return p.startsWith("/") || DRIVE_PREFIX.matcher(p).find();
    }

    private static String absoluteOf(String p, String cwd) {
        String combined = isAbsolute(p) ? p : (p.isEmpty() ? cwd : cwd + "/" + p);

        String root;
        String rest;
        if (DRIVE_PREFIX.matcher(combined).find()) {
            root = combined.substring(0, 2) + "/";
            rest = combined.substring(2);
        } else {
            root = "/";
            rest = combined;
        }

        Deque<String> stack = new ArrayDeque<>();
        for (String seg : rest.split("/")) {
            if (seg.isEmpty() || seg.equals(".")) continue;
            if (seg.equals("..")) {
                stack.pollLast();
                continue;
            }
            stack.addLast(seg);
        }
        return root + String.join("/", stack);
    }

    private static String relativize(String abs, String cwd) {
        if (abs.equals(cwd)) return ".";
        String prefix = StringUtils.appendIfMissing(cwd, "/");
        if (abs.startsWith(prefix)) {
            return "./" + abs.substring(prefix.length());
        }
        return abs;
    }
}
