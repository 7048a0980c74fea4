package org.dxworks.treeline;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.treeline.parser.LineParser;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TreelineConfig {

    private static final String CONFIG_FILE_NAME = "treeline-config.yml";
    private static final int DEFAULT_INDENT_WIDTH = LineParser.DEFAULT_INDENT_WIDTH;
    private static final String DEFAULT_FALLBACK_CHARSET = "GBK";
    private static final boolean DEFAULT_SKIP_LISTING_HEADER = true;
    private static final boolean DEFAULT_ACCEPT_BARE_NAMES = true;

    private final int indentWidth;
    private final Charset fallbackCharset;
    private final boolean skipListingHeader;
    private final boolean acceptBareNames;

    private TreelineConfig(int indentWidth, Charset fallbackCharset, boolean skipListingHeader, boolean acceptBareNames) {
        this.indentWidth = indentWidth;
        this.fallbackCharset = fallbackCharset;
        this.skipListingHeader = skipListingHeader;
        this.acceptBareNames = acceptBareNames;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public Charset getFallbackCharset() {
        return fallbackCharset;
    }

    public boolean isSkipListingHeader() {
        return skipListingHeader;
    }

    public boolean isAcceptBareNames() {
        return acceptBareNames;
    }

    public static TreelineConfig defaults() {
        return new TreelineConfig(DEFAULT_INDENT_WIDTH, charsetOrDefault(DEFAULT_FALLBACK_CHARSET),
                DEFAULT_SKIP_LISTING_HEADER, DEFAULT_ACCEPT_BARE_NAMES);
    }

    public static TreelineConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static TreelineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveIndentWidth = (yamlConfig.indentWidth != null && yamlConfig.indentWidth > 0)
                        ? yamlConfig.indentWidth
                        : DEFAULT_INDENT_WIDTH;
                Charset effectiveCharset = charsetOrDefault(yamlConfig.fallbackCharset != null
                        ? yamlConfig.fallbackCharset
                        : DEFAULT_FALLBACK_CHARSET);
                boolean effectiveSkipHeader = yamlConfig.skipListingHeader != null
                        ? yamlConfig.skipListingHeader
                        : DEFAULT_SKIP_LISTING_HEADER;
                boolean effectiveBareNames = yamlConfig.acceptBareNames != null
                        ? yamlConfig.acceptBareNames
                        : DEFAULT_ACCEPT_BARE_NAMES;

                return new TreelineConfig(effectiveIndentWidth, effectiveCharset, effectiveSkipHeader, effectiveBareNames);
            }
        } catch (IOException e) {
            // Fall through to default
        }

        return defaults();
    }

    public static TreelineConfig with(int indentWidth, String fallbackCharset, boolean skipListingHeader,
                                      boolean acceptBareNames) {
        int effectiveIndentWidth = indentWidth > 0 ? indentWidth : DEFAULT_INDENT_WIDTH;
        return new TreelineConfig(effectiveIndentWidth, charsetOrDefault(fallbackCharset),
                skipListingHeader, acceptBareNames);
    }

    private static Charset charsetOrDefault(String name) {
        try {
            if (name != null && Charset.isSupported(name)) {
                return Charset.forName(name);
            }
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            // unusable name, use the platform default below
        }
        return Charset.defaultCharset();
    }

    private static class YamlConfig {
        public Integer indentWidth;
        public String fallbackCharset;
        public Boolean skipListingHeader;
        public Boolean acceptBareNames;
    }
}
