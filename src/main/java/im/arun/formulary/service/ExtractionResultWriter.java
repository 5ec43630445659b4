package im.arun.formulary.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.formulary.model.Category;
import im.arun.formulary.model.ExtractionResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists an {@link ExtractionResult} as the three JSON files of a document's output directory.
 */
public class ExtractionResultWriter {
    public static final String CATEGORIES_FILE = "extracted_data.json";
    public static final String WARNINGS_FILE = "extraction_warnings.json";
    public static final String TOC_FILE = "table_of_contents.json";

    private final ObjectMapper objectMapper;

    public ExtractionResultWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write categories, warnings and table of contents into {@code documentDir}.
     *
     * @return path of the categories file
     */
    public Path write(ExtractionResult result, Path documentDir) throws IOException {
        Files.createDirectories(documentDir);
        Path categoriesPath = documentDir.resolve(CATEGORIES_FILE);
        objectMapper.writeValue(categoriesPath.toFile(), result.getCategories());
        objectMapper.writeValue(documentDir.resolve(WARNINGS_FILE).toFile(), result.getWarnings());
        objectMapper.writeValue(documentDir.resolve(TOC_FILE).toFile(), result.getTableOfContents());
        return categoriesPath;
    }

    public List<Category> readCategories(Path categoriesPath) throws IOException {
        return objectMapper.readValue(categoriesPath.toFile(), new TypeReference<List<Category>>() {});
    }

    public String toJson(ExtractionResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }
}
