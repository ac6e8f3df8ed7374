package com.filetree.core.tree;

import com.filetree.core.filter.PathFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Lists and walks directories under the root, dropping entries rejected by
 * the {@link PathFilter} and ordering the rest: directories first, then
 * files, each group by case-insensitive name.
 * <p>
 * Shared by {@link TreeModel} (lazy population) and the document builder
 * (full walk), so both see the same entries in the same order.
 */
public class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    static final Comparator<TreeEntry> ORDER = Comparator
            .comparing((TreeEntry e) -> !e.directory())
            .thenComparing(e -> e.name().toLowerCase(Locale.ROOT))
            .thenComparing(TreeEntry::name);

    private final PathFilter filter;

    public TreeWalker(PathFilter filter) {
        this.filter = filter;
    }

    /**
     * Lists the surviving entries of {@code dir} in display order.
     *
     * @throws IOException if the directory cannot be listed
     */
    public List<TreeEntry> list(Path dir) throws IOException {
        List<TreeEntry> entries = new ArrayList<>();
        try (var stream = Files.list(dir)) {
            stream.filter(p -> !filter.shouldSkip(p))
                  .forEach(p -> entries.add(TreeEntry.of(p, Files.isDirectory(p))));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        entries.sort(ORDER);
        return entries;
    }

    /**
     * Depth-first pre-order walk below {@code dir}. Every directory is descended
     * into. A directory that cannot be listed is treated as empty.
     */
    public void walk(Path dir, TreeVisitor visitor) {
        walk(dir, new ArrayList<>(), visitor);
    }

    /** Every non-directory entry below {@code dir}, in walk order. */
    public List<Path> files(Path dir) {
        List<Path> files = new ArrayList<>();
        walk(dir, (entry, ancestorsLast, last) -> {
            if (!entry.directory()) {
                files.add(entry.path());
            }
        });
        return files;
    }

    public PathFilter filter() {
        return filter;
    }

    private void walk(Path dir, List<Boolean> ancestorsLast, TreeVisitor visitor) {
        List<TreeEntry> entries;
        try {
            entries = list(dir);
        } catch (IOException e) {
            log.warn("Skipping unreadable directory {}: {}", dir, e.toString());
            return;
        }
        List<Boolean> ancestors = List.copyOf(ancestorsLast);
        for (int i = 0; i < entries.size(); i++) {
            TreeEntry entry = entries.get(i);
            boolean last = i == entries.size() - 1;
            visitor.visit(entry, ancestors, last);
            if (entry.directory()) {
                ancestorsLast.add(last);
                walk(entry.path(), ancestorsLast, visitor);
                ancestorsLast.remove(ancestorsLast.size() - 1);
            }
        }
    }
}
