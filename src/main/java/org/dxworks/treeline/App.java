package org.dxworks.treeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.treeline.hierarchy.HierarchyNode;
import org.dxworks.treeline.listing.TreeAssembler;
import org.dxworks.treeline.listing.TreeListingReader;
import org.dxworks.treeline.model.ListingAnalysis;
import org.dxworks.treeline.model.SkippedLine;
import org.dxworks.treeline.model.TreeEntry;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final String NESTED_FLAG = "--nested";

    public static void main(String[] args) throws Exception {
        if (args.length < 2 || (args.length == 3 && !NESTED_FLAG.equals(args[2])) || args.length > 3) {
            System.err.println("Usage: java -jar treeline.jar <listing-file> <output-file> [--nested]");
            System.err.println("  <listing-file>: Text printed by a tree command (e.g. tree /F > listing.txt)");
            System.err.println("  <output-file>:  Path to output JSONL file (JSON with --nested)");
            System.err.println("  --nested:       Write one nested tree document instead of JSON Lines");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Listing file does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        boolean nested = args.length == 3;

        System.out.println("Reading tree listing...");
        System.out.println("Input: " + input.toAbsolutePath());

        TreelineConfig config = TreelineConfig.load();
        Instant startTime = Instant.now();
        ListingAnalysis analysis;
        try {
            analysis = new TreeListingReader(config).read(input);
        } catch (IOException e) {
            System.err.println("Error: Failed to read " + input + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        for (SkippedLine skipped : analysis.skipped) {
            System.err.println("  Skipped line " + skipped.lineNumber + " (" + skipped.reason + "): " + skipped.line);
        }

        if (nested) {
            writeNested(output, analysis);
        } else {
            writeJsonLines(output, analysis, startTime);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Reconstruction complete!");
        System.out.println("Nodes: " + analysis.nodes.size());
        if (!analysis.skipped.isEmpty()) {
            System.out.println("Skipped lines: " + analysis.skipped.size());
        }
        if (analysis.depthDiscontinuities > 0) {
            System.out.println("Depth jumps: " + analysis.depthDiscontinuities);
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static void writeJsonLines(Path output, ListingAnalysis analysis, Instant startTime) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", analysis.filePath);
            runInfo.put("root", analysis.root);
            runInfo.put("lines_read", analysis.linesRead);
            writeRecord(writer, runInfo);

            for (HierarchyNode node : analysis.nodes) {
                writeRecord(writer, nodeRecord(node));
            }

            for (SkippedLine skipped : analysis.skipped) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("kind", "skipped");
                record.put("line_number", skipped.lineNumber);
                record.put("reason", skipped.reason);
                record.put("line", skipped.line);
                writeRecord(writer, record);
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("nodes", analysis.nodes.size());
            doneInfo.put("skipped_lines", analysis.skipped.size());
            doneInfo.put("header_lines", analysis.headerLines);
            doneInfo.put("depth_discontinuities", analysis.depthDiscontinuities);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }
    }

    static Map<String, Object> nodeRecord(HierarchyNode node) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "node");
        record.put("line_number", node.getLineNumber());
        record.put("name", node.getName());
        record.put("depth", node.getDepth());
        record.put("indent_depth", node.getIndentDepth());
        record.put("full_path", node.getFullPath());
        record.put("parent_path", node.getParentPath());
        record.put("last_sibling", node.isLastSibling());
        return record;
    }

    static void writeNested(Path output, ListingAnalysis analysis) throws IOException {
        List<TreeEntry> entries = TreeAssembler.assemble(analysis.nodes);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("input_path", analysis.filePath);
        document.put("root", analysis.root);
        document.put("folders", TreeAssembler.countFolders(entries));
        document.put("entries", entries);
        PRETTY_MAPPER.writeValue(output.toFile(), document);
    }

    private static void writeRecord(BufferedWriter writer, Map<String, Object> record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
    }
}
