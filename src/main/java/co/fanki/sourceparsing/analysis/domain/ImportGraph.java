package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * File-level import graph of a set of source files.
 *
 * <p>Language-agnostic: nodes are repository paths, each carrying the
 * {@link ParseResult} of its file, and an edge from A to B means that an
 * import of A resolved to B. Relative imports that matched no file are
 * kept apart, since they usually point at a missing or misspelled
 * module.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImportGraph {

    /** Maps path to the parse result of that file. */
    private final Map<String, ParseResult> files = new LinkedHashMap<>();

    /** Maps path to its direct dependencies (outgoing edges). */
    private final Map<String, Set<String>> edges = new HashMap<>();

    /** Maps path to its relative imports that resolved to nothing. */
    private final Map<String, List<Import>> unresolved =
            new LinkedHashMap<>();

    /**
     * Adds a file to the graph.
     *
     * @param path the repository-relative path
     * @param result the parse result of the file
     */
    public void addFile(final String path, final ParseResult result) {
        Preconditions.requireNonBlank(path, "Path is required");
        Preconditions.requireNonNull(result, "Parse result is required");
        files.put(path, result);
    }

    /**
     * Adds an edge from an importing file to the file it imports.
     *
     * <p>Only adds the edge if both files are part of the graph. Self
     * imports are ignored.</p>
     *
     * @param from the importing path
     * @param to the imported path
     */
    public void addDependency(final String from, final String to) {
        Preconditions.requireNonBlank(from, "From path is required");
        Preconditions.requireNonBlank(to, "To path is required");

        if (from.equals(to) || !files.containsKey(from)
                || !files.containsKey(to)) {
            return;
        }
        edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    /**
     * Records a relative import that matched no file.
     *
     * @param path the importing path
     * @param unresolvedImport the import
     */
    public void addUnresolved(final String path,
            final Import unresolvedImport) {
        Preconditions.requireNonBlank(path, "Path is required");
        Preconditions.requireNonNull(unresolvedImport, "Import is required");
        unresolved.computeIfAbsent(path, k -> new ArrayList<>())
                .add(unresolvedImport);
    }

    /**
     * Returns the direct dependencies of a file.
     *
     * @param path the file path
     * @return the imported paths in discovery order, empty if none
     */
    public Set<String> dependencies(final String path) {
        return Collections.unmodifiableSet(
                edges.getOrDefault(path, Set.of()));
    }

    /**
     * Returns the files importing the given file.
     *
     * @param path the file path
     * @return the importing paths in file order
     */
    public Set<String> dependents(final String path) {
        final Set<String> result = new LinkedHashSet<>();
        for (final String candidate : files.keySet()) {
            if (edges.getOrDefault(candidate, Set.of()).contains(path)) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * Returns every file reachable from the given one through imports,
     * closest first. The start file is not included.
     *
     * @param path the start file
     * @return the transitive dependencies in breadth-first order
     */
    public List<String> transitiveDependencies(final String path) {
        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        queue.add(path);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final String dependency
                    : edges.getOrDefault(current, Set.of())) {
                if (!dependency.equals(path) && visited.add(dependency)) {
                    queue.add(dependency);
                }
            }
        }
        return List.copyOf(visited);
    }

    /**
     * Returns the files that no other file imports.
     *
     * @return the orphan paths in file order
     */
    public Set<String> orphans() {
        final Set<String> imported = new LinkedHashSet<>();
        for (final Set<String> targets : edges.values()) {
            imported.addAll(targets);
        }
        final Set<String> result = new LinkedHashSet<>(files.keySet());
        result.removeAll(imported);
        return result;
    }

    /**
     * Returns the relative imports of a file that matched no file.
     *
     * @param path the file path
     * @return the unresolved imports in source order, empty if none
     */
    public List<Import> unresolvedImports(final String path) {
        return List.copyOf(unresolved.getOrDefault(path, List.of()));
    }

    /**
     * Returns every file with at least one unresolved relative import.
     *
     * @return the paths in file order
     */
    public Set<String> filesWithUnresolvedImports() {
        return Collections.unmodifiableSet(unresolved.keySet());
    }

    /**
     * Returns the parse result of a file.
     *
     * @param path the file path
     * @return the parse result, null if the file is not in the graph
     */
    public ParseResult parseResult(final String path) {
        return files.get(path);
    }

    /**
     * Checks if a file is part of the graph.
     *
     * @param path the file path
     * @return true if it was added
     */
    public boolean contains(final String path) {
        return files.containsKey(path);
    }

    /**
     * Returns all file paths.
     *
     * @return the paths in insertion order
     */
    public Set<String> paths() {
        return Collections.unmodifiableSet(files.keySet());
    }

    /**
     * Returns the total number of files.
     *
     * @return the file count
     */
    public int fileCount() {
        return files.size();
    }

    /**
     * Returns the total number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        int count = 0;
        for (final Set<String> targets : edges.values()) {
            count += targets.size();
        }
        return count;
    }

}
