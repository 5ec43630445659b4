package im.arun.formulary.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ExtractionConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ExtractionConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), ExtractionConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath config.yaml", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml");
            if (resourceStream != null) {
                try (resourceStream) {
                    return yamlMapper.readValue(resourceStream, ExtractionConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new ExtractionConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ExtractionConfig();
        }
    }

    public ExtractionConfig load() {
        return load(null);
    }

    /**
     * Copies the loaded defaults and applies the caller's options on top.
     * Keys may be snake_case or camelCase; unknown keys are logged and skipped.
     *
     * @throws IllegalArgumentException when the merged configuration is invalid
     */
    public ExtractionConfig load(Map<String, Object> userOptions) {
        ExtractionConfig config = copyConfig(defaultConfig);

        if (userOptions != null) {
            userOptions.forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                try {
                    switch (key) {
                        case "front_matter_page_limit":
                        case "frontMatterPageLimit":
                            config.setFrontMatterPageLimit(toNumber(value).intValue());
                            break;
                        case "column_tolerance":
                        case "columnTolerance":
                            config.setColumnTolerance(toNumber(value).floatValue());
                            break;
                        case "lenient_rows":
                        case "lenientRows":
                            config.setLenientRows(parseBoolean(value));
                            break;
                        case "line_merge_tolerance":
                        case "lineMergeTolerance":
                            config.setLineMergeTolerance(toNumber(value).floatValue());
                            break;
                        case "cell_gap_ratio":
                        case "cellGapRatio":
                            config.setCellGapRatio(toNumber(value).floatValue());
                            break;
                        case "header_font_ratio":
                        case "headerFontRatio":
                            config.setHeaderFontRatio(toNumber(value).floatValue());
                            break;
                        case "category_font_ratio":
                        case "categoryFontRatio":
                            config.setCategoryFontRatio(toNumber(value).floatValue());
                            break;
                        case "indent_tolerance":
                        case "indentTolerance":
                            config.setIndentTolerance(toNumber(value).floatValue());
                            break;
                        case "margin_band":
                        case "marginBand":
                            config.setMarginBand(toNumber(value).floatValue());
                            break;
                        case "max_header_length":
                        case "maxHeaderLength":
                            config.setMaxHeaderLength(toNumber(value).intValue());
                            break;
                        case "min_toc_entries":
                        case "minTocEntries":
                            config.setMinTocEntries(toNumber(value).intValue());
                            break;
                        case "default_body_font_size":
                        case "defaultBodyFontSize":
                            config.setDefaultBodyFontSize(toNumber(value).floatValue());
                            break;
                        case "column_header_keywords":
                        case "columnHeaderKeywords":
                            config.setColumnHeaderKeywords(toStringList(value));
                            break;
                        case "noise_patterns":
                        case "noisePatterns":
                            config.setNoisePatterns(toStringList(value));
                            break;
                        default:
                            logger.warn("Unknown configuration key: {}", key);
                    }
                } catch (RuntimeException e) {
                    logger.error("Error setting config key {}: {}", key, e.getMessage());
                }
            });
        }

        config.validate();
        return config;
    }

    private Number toNumber(Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        return Double.valueOf(value.toString().trim());
    }

    private List<String> toStringList(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof Iterable<?>) {
            for (Object item : (Iterable<?>) value) {
                values.add(String.valueOf(item));
            }
        } else {
            for (String item : value.toString().split(",")) {
                if (!item.isBlank()) {
                    values.add(item.trim());
                }
            }
        }
        return values;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private ExtractionConfig copyConfig(ExtractionConfig source) {
        ExtractionConfig copy = new ExtractionConfig();
        copy.setFrontMatterPageLimit(source.getFrontMatterPageLimit());
        copy.setColumnTolerance(source.getColumnTolerance());
        copy.setLenientRows(source.isLenientRows());
        copy.setLineMergeTolerance(source.getLineMergeTolerance());
        copy.setCellGapRatio(source.getCellGapRatio());
        copy.setHeaderFontRatio(source.getHeaderFontRatio());
        copy.setCategoryFontRatio(source.getCategoryFontRatio());
        copy.setIndentTolerance(source.getIndentTolerance());
        copy.setMarginBand(source.getMarginBand());
        copy.setMaxHeaderLength(source.getMaxHeaderLength());
        copy.setMinTocEntries(source.getMinTocEntries());
        copy.setDefaultBodyFontSize(source.getDefaultBodyFontSize());
        copy.setColumnHeaderKeywords(new ArrayList<>(source.getColumnHeaderKeywords()));
        copy.setNoisePatterns(new ArrayList<>(source.getNoisePatterns()));
        return copy;
    }
}
