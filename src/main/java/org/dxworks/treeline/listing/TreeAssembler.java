package org.dxworks.treeline.listing;

import org.dxworks.treeline.hierarchy.HierarchyNode;
import org.dxworks.treeline.model.TreeEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Nests emitted nodes into {@link TreeEntry} objects. Nodes must be given in
 * emission order; a node is attached to the closest preceding entry with a
 * lower depth, or becomes a top-level entry.
 */
public final class TreeAssembler {

    private static final String PATH_SEPARATOR = "/";

    private TreeAssembler() {}

    public static List<TreeEntry> assemble(List<HierarchyNode> nodes) {
        List<TreeEntry> roots = new ArrayList<>();
        List<TreeEntry> entryStack = new ArrayList<>();

        for (HierarchyNode node : nodes) {
            TreeEntry entry = new TreeEntry();
            entry.name = node.getName();
            entry.depth = node.getDepth();
            entry.path = node.joinedPath(PATH_SEPARATOR);

            while (!entryStack.isEmpty() && entryStack.get(entryStack.size() - 1).depth >= entry.depth) {
                entryStack.remove(entryStack.size() - 1);
            }

            if (entryStack.isEmpty()) {
                roots.add(entry);
            } else {
                entryStack.get(entryStack.size() - 1).children.add(entry);
            }
            entryStack.add(entry);
        }
        return roots;
    }

    public static int countFolders(List<TreeEntry> entries) {
        int folders = 0;
        for (TreeEntry entry : entries) {
            if (entry.isFolder()) {
                folders++;
                folders += countFolders(entry.children);
            }
        }
        return folders;
    }
}
