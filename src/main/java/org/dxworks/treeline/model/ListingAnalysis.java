package org.dxworks.treeline.model;

import org.dxworks.treeline.hierarchy.HierarchyNode;

import java.util.ArrayList;
import java.util.List;

public class ListingAnalysis {
    public String filePath; // nullable for in-memory listings
    public String root; // nullable when the listing has no root line
    public int linesRead;
    public int headerLines;
    public int depthDiscontinuities;
    public List<HierarchyNode> nodes = new ArrayList<>();
    public List<SkippedLine> skipped = new ArrayList<>();
}
