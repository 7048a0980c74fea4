package org.dxworks.treeline.model;

import java.util.ArrayList;
import java.util.List;

public class TreeEntry {
    public String name;
    public int depth;
    public String path;
    public List<TreeEntry> children = new ArrayList<>();

    /**
     * Entries with children are folders. A leaf may still be an empty folder,
     * the listing alone cannot tell.
     */
    public boolean isFolder() {
        return !children.isEmpty();
    }
}
