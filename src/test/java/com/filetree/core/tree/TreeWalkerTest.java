package com.filetree.core.tree;

import com.filetree.core.filter.PathFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeWalkerTest {

    @TempDir
    Path root;

    TreeWalker walker;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src/util"));
        Files.createDirectories(root.resolve("Docs"));
        Files.createDirectories(root.resolve(".git/objects"));
        Files.writeString(root.resolve("src/Main.java"), "class Main {}");
        Files.writeString(root.resolve("src/util/a.txt"), "a");
        Files.writeString(root.resolve("b.txt"), "b");
        Files.writeString(root.resolve("A.md"), "# A");
        Files.writeString(root.resolve("Docs/guide.md"), "guide");
        Files.writeString(root.resolve(".git/config"), "");

        walker = new TreeWalker(new PathFilter(root, List.of(".git"), true));
    }

    @Test
    @DisplayName("lists directories first, then files, case-insensitively by name")
    void listsInDisplayOrder() throws IOException {
        List<String> names = walker.list(root).stream().map(TreeEntry::name).toList();
        assertEquals(List.of("Docs", "src", "A.md", "b.txt"), names);
    }

    @Test
    @DisplayName("drops excluded entries")
    void dropsExcluded() throws IOException {
        assertTrue(walker.list(root).stream().noneMatch(e -> e.name().equals(".git")));
    }

    @Test
    @DisplayName("listing a missing directory fails")
    void listMissingDirectoryThrows() {
        assertThrows(NoSuchFileException.class, () -> walker.list(root.resolve("missing")));
    }

    @Test
    @DisplayName("walk visits depth-first with last-sibling flags")
    void walkDepthFirst() {
        List<String> visits = new ArrayList<>();
        walker.walk(root, (entry, ancestorsLast, last) ->
                visits.add(root.relativize(entry.path()).toString().replace('\\', '/')
                        + " " + ancestorsLast + " " + last));

        assertEquals(List.of(
                "Docs [] false",
                "Docs/guide.md [false] true",
                "src [] false",
                "src/util [false] false",
                "src/util/a.txt [false, false] true",
                "src/Main.java [false] true",
                "A.md [] false",
                "b.txt [] true"
        ), visits);
    }

    @Test
    @DisplayName("files lists every non-directory entry in walk order")
    void filesInWalkOrder() {
        List<String> files = walker.files(root).stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .toList();
        assertEquals(List.of("Docs/guide.md", "src/util/a.txt", "src/Main.java", "A.md", "b.txt"), files);
    }

    @Test
    @DisplayName("walking a missing directory visits nothing")
    void walkMissingDirectory() {
        List<TreeEntry> visited = new ArrayList<>();
        walker.walk(root.resolve("missing"), (entry, ancestorsLast, last) -> visited.add(entry));
        assertTrue(visited.isEmpty());
    }
}
