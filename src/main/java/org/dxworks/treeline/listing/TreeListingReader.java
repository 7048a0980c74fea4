package org.dxworks.treeline.listing;

import org.dxworks.treeline.TreelineConfig;
import org.dxworks.treeline.hierarchy.HierarchyNode;
import org.dxworks.treeline.hierarchy.HierarchyReconstructor;
import org.dxworks.treeline.model.ListingAnalysis;
import org.dxworks.treeline.model.SkippedLine;
import org.dxworks.treeline.parser.LineParser;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reads a whole listing printed by a {@code tree}-style command and runs it
 * through a fresh {@link HierarchyReconstructor}.
 */
public class TreeListingReader {

    private final TreelineConfig config;

    public TreeListingReader(TreelineConfig config) {
        this.config = config;
    }

    public ListingAnalysis read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        ListingAnalysis analysis = analyze(decode(bytes, config.getFallbackCharset()));
        analysis.filePath = file.toString();
        return analysis;
    }

    public ListingAnalysis analyze(String text) {
        return analyze(Arrays.asList(text.split("\r?\n")));
    }

    public ListingAnalysis analyze(List<String> lines) {
        ListingAnalysis analysis = new ListingAnalysis();
        HierarchyReconstructor reconstructor = new HierarchyReconstructor(
                new LineParser(config.getIndentWidth()), config.isAcceptBareNames());
        reconstructor.setSkippedLineListener((lineNumber, line, problem) ->
                analysis.skipped.add(new SkippedLine(lineNumber, line, problem)));

        boolean inHeader = config.isSkipListingHeader();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (inHeader) {
                if (isHeaderLine(line)) {
                    analysis.headerLines++;
                    continue;
                }
                if (!line.isBlank()) {
                    inHeader = false;
                }
            }

            Optional<HierarchyNode> node = reconstructor.feed(line, lineNumber);
            node.ifPresent(analysis.nodes::add);
        }

        analysis.linesRead = lineNumber;
        analysis.depthDiscontinuities = reconstructor.getDepthDiscontinuities();
        if (reconstructor.hasRoot() && !analysis.nodes.isEmpty()) {
            analysis.root = analysis.nodes.get(0).getName();
        }
        return analysis;
    }

    /**
     * Preamble printed by Windows {@code tree}, e.g.
     * {@code Folder PATH listing for volume OS} and {@code Volume serial number is 1234-ABCD}.
     */
    static boolean isHeaderLine(String line) {
        return (line.contains("PATH") && line.contains("listing"))
                || line.contains("Volume serial number");
    }

    /**
     * Decodes strict UTF-8 first and falls back to {@code fallback} on malformed
     * input. A leading byte order mark is dropped.
     */
    static String decode(byte[] bytes, Charset fallback) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            text = new String(bytes, fallback);
        }
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return text;
    }
}
