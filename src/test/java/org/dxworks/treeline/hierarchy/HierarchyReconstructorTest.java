package org.dxworks.treeline.hierarchy;

import org.dxworks.treeline.parser.LineParser;
import org.dxworks.treeline.parser.LineProblem;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HierarchyReconstructorTest {

    @Test
    void siblingReplacesPreviousEntryOnStack() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        HierarchyNode root = reconstructor.feed("root").orElseThrow();
        HierarchyNode a = reconstructor.feed("├─a").orElseThrow();
        HierarchyNode b = reconstructor.feed("│  ├─b").orElseThrow();
        assertEquals(List.of("root", "a", "b"), reconstructor.currentPath());
        HierarchyNode c = reconstructor.feed("│  └─c").orElseThrow();

        assertEquals(0, root.getDepth());
        assertEquals(List.of("root"), root.getFullPath());
        assertEquals(List.of("root", "a"), a.getFullPath());
        assertEquals(List.of("root", "a", "b"), b.getFullPath());
        assertEquals(List.of("root", "a"), b.getParentPath());
        assertEquals(List.of("root", "a", "c"), c.getFullPath());
        assertEquals(2, c.getDepth());
        assertTrue(c.isLastSibling());
        assertEquals(List.of("root", "a", "c"), reconstructor.currentPath());
    }

    @Test
    void emitsPathsForStandardTreeOutput() {
        List<HierarchyNode> nodes = feedAll(new HierarchyReconstructor(),
                ".",
                "├── src",
                "│   ├── main",
                "│   │   └── App.java",
                "│   └── test",
                "└── pom.xml");

        assertEquals(List.of(
                ".",
                "./src",
                "./src/main",
                "./src/main/App.java",
                "./src/test",
                "./pom.xml"), joined(nodes));
    }

    @Test
    void withoutRootLineConnectorLinesStartAtLevelZero() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        HierarchyNode first = reconstructor.feed("├── a").orElseThrow();
        HierarchyNode child = reconstructor.feed("│   └── b").orElseThrow();
        HierarchyNode second = reconstructor.feed("└── c").orElseThrow();

        assertFalse(reconstructor.hasRoot());
        assertEquals(0, first.getDepth());
        assertEquals(List.of("a", "b"), child.getFullPath());
        assertEquals(List.of("c"), second.getFullPath());
    }

    @Test
    void invalidLinesLeaveStackUnchangedAndAreReported() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();
        List<String> reports = new ArrayList<>();
        reconstructor.setSkippedLineListener((lineNumber, line, problem) ->
                reports.add(lineNumber + ":" + problem));

        reconstructor.feed("root");
        reconstructor.feed("├── a");
        Optional<HierarchyNode> truncated = reconstructor.feed("│ ");
        Optional<HierarchyNode> bare = reconstructor.feed("│   loose text");
        HierarchyNode b = reconstructor.feed("│   └── b").orElseThrow();

        assertTrue(truncated.isEmpty());
        assertTrue(bare.isEmpty());
        assertEquals(List.of("3:TRUNCATED_INDENTATION", "4:NO_CONNECTOR"), reports);
        assertEquals(2, reconstructor.getSkippedLines());
        assertEquals(List.of("root", "a", "b"), b.getFullPath());
        assertEquals(5, b.getLineNumber());
    }

    @Test
    void blankAndSpacerLinesAreIgnoredSilently() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        reconstructor.feed("");
        reconstructor.feed("root");
        reconstructor.feed("│   ");
        reconstructor.feed("   ");
        HierarchyNode a = reconstructor.feed("└── a").orElseThrow();

        assertEquals(0, reconstructor.getSkippedLines());
        assertEquals(List.of("root", "a"), a.getFullPath());
        assertEquals(5, reconstructor.getLinesFed());
    }

    @Test
    void trimmedSeparatorRowsAreNotReported() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        reconstructor.feed("root");
        reconstructor.feed("├── a");
        reconstructor.feed("│");
        reconstructor.feed("│   │");
        HierarchyNode b = reconstructor.feed("└── b").orElseThrow();

        assertEquals(0, reconstructor.getSkippedLines());
        assertEquals(List.of("root", "b"), b.getFullPath());
    }

    @Test
    void compressedChildrenOfLastSiblingKeepTheirParent() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        List<HierarchyNode> nodes = feedAll(reconstructor,
                "project",
                "├─src",
                "│  └─models",
                "│     └─user.py",
                "└─a",
                "   └─b");

        assertEquals(List.of(
                "project",
                "project/src",
                "project/src/models",
                "project/src/models/user.py",
                "project/a",
                "project/a/b"), joined(nodes));
        assertEquals(0, reconstructor.getDepthDiscontinuities());
    }

    @Test
    void nodesKeepParsedIndentDepthNextToTreeLevel() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        HierarchyNode root = reconstructor.feed("root").orElseThrow();
        HierarchyNode a = reconstructor.feed("├─a").orElseThrow();
        HierarchyNode b = reconstructor.feed("│  ├─b").orElseThrow();

        assertEquals(0, root.getIndentDepth());
        assertEquals(0, root.getDepth());
        assertEquals(0, a.getIndentDepth());
        assertEquals(1, a.getDepth());
        assertEquals(1, b.getIndentDepth());
        assertEquals(2, b.getDepth());
    }

    @Test
    void withoutRootIndentDepthEqualsLevel() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        reconstructor.feed("├── a");
        HierarchyNode b = reconstructor.feed("│   └── b").orElseThrow();

        assertEquals(1, b.getIndentDepth());
        assertEquals(1, b.getDepth());
    }

    @Test
    void depthJumpIsAcceptedAndCounted() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        reconstructor.feed("root");
        reconstructor.feed("├── a");
        HierarchyNode deep = reconstructor.feed("│   │   │   └── deep").orElseThrow();
        HierarchyNode back = reconstructor.feed("└── z").orElseThrow();

        assertEquals(4, deep.getDepth());
        assertEquals(List.of("root", "a", "deep"), deep.getFullPath());
        assertEquals(List.of("root", "z"), back.getFullPath());
        assertEquals(1, reconstructor.getDepthDiscontinuities());
    }

    @Test
    void bareNamesBecomeChildrenWhenAccepted() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor(new LineParser(), true);

        List<HierarchyNode> nodes = feedAll(reconstructor,
                "C:.",
                "│   notes.txt",
                "│   ",
                "├───docs",
                "│       guide.md",
                "│       ",
                "└───src",
                "    │   Program.cs",
                "    │   ",
                "    └───bin");

        assertEquals(List.of(
                "C:.",
                "C:./notes.txt",
                "C:./docs",
                "C:./docs/guide.md",
                "C:./src",
                "C:./src/Program.cs",
                "C:./src/bin"), joined(nodes));
        assertEquals(0, reconstructor.getSkippedLines());
    }

    @Test
    void explicitLineNumbersAreKept() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();

        HierarchyNode root = reconstructor.feed("D:.", 3).orElseThrow();
        HierarchyNode next = reconstructor.feed("└───x").orElseThrow();

        assertEquals(3, root.getLineNumber());
        assertEquals(4, next.getLineNumber());
    }

    @Test
    void resetStartsANewStream() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();
        reconstructor.feed("first");
        reconstructor.feed("└── a");

        reconstructor.reset();
        HierarchyNode a = reconstructor.feed("└── a").orElseThrow();

        assertFalse(reconstructor.hasRoot());
        assertEquals(List.of("a"), a.getFullPath());
        assertEquals(1, a.getLineNumber());
    }

    @Test
    void lateConnectorlessLineIsNotARoot() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();
        reconstructor.feed("├── a");

        assertTrue(reconstructor.feed("stray").isEmpty());
        assertEquals(1, reconstructor.getSkippedLines());
        assertEquals(List.of("a"), reconstructor.currentPath());
    }

    @Test
    void skippedProblemIsPassedToListener() {
        HierarchyReconstructor reconstructor = new HierarchyReconstructor();
        List<LineProblem> problems = new ArrayList<>();
        reconstructor.setSkippedLineListener((lineNumber, line, problem) -> problems.add(problem));

        reconstructor.feed("root");
        reconstructor.feed("└── ");

        assertEquals(List.of(LineProblem.EMPTY_NAME), problems);
    }

    private static List<HierarchyNode> feedAll(HierarchyReconstructor reconstructor, String... lines) {
        List<HierarchyNode> nodes = new ArrayList<>();
        for (String line : lines) {
            reconstructor.feed(line).ifPresent(nodes::add);
        }
        return nodes;
    }

    private static List<String> joined(List<HierarchyNode> nodes) {
        List<String> paths = new ArrayList<>();
        for (HierarchyNode node : nodes) {
            paths.add(node.joinedPath("/"));
        }
        return paths;
    }
}
