package im.arun.formulary.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.formulary.model.Category;
import im.arun.formulary.model.ExtractionResult;
import im.arun.formulary.model.ExtractionWarning;
import im.arun.formulary.model.SubCategory;
import im.arun.formulary.model.TocEntry;
import im.arun.formulary.model.WarningReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionResultWriterTest {

    @TempDir
    Path tempDir;

    private final ExtractionResultWriter writer = new ExtractionResultWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesTheThreeOutputFiles() throws IOException {
        Path categoriesPath = writer.write(sampleResult(), tempDir);

        JsonNode categories = mapper.readTree(categoriesPath.toFile());
        assertThat(categories.isArray()).isTrue();
        JsonNode penicillins = categories.get(0).get("subCategories").get(0);
        assertThat(categories.get(0).get("name").asText()).isEqualTo("Antibiotics");
        assertThat(penicillins.get("name").asText()).isEqualTo("Penicillins");
        assertThat(penicillins.get("rows").get(0).fieldNames()).toIterable().containsExactly("Drug Name", "Tier");

        JsonNode warnings = mapper.readTree(tempDir.resolve(ExtractionResultWriter.WARNINGS_FILE).toFile());
        assertThat(warnings.get(0).get("reason").asText()).isEqualTo("malformed_row");
        assertThat(warnings.get(0).get("pageNumber").asInt()).isEqualTo(4);
        assertThat(warnings.get(0).has("context")).isFalse();
        assertThat(warnings.get(1).get("context").asText()).isEqualTo("Antibiotics");

        JsonNode toc = mapper.readTree(tempDir.resolve(ExtractionResultWriter.TOC_FILE).toFile());
        assertThat(toc.get(0).get("pageReference").isInt()).isTrue();
        assertThat(toc.get(1).get("pageReference").asText()).isEqualTo("iv");
    }

    @Test
    void serializesWholeResultWithSnakeCaseTocKey() throws IOException {
        JsonNode json = mapper.readTree(writer.toJson(sampleResult()));

        assertThat(json.fieldNames()).toIterable().containsExactly("categories", "warnings", "table_of_contents");
    }

    @Test
    void readsCategoriesBack() throws IOException {
        Path categoriesPath = writer.write(sampleResult(), tempDir);

        List<Category> categories = writer.readCategories(categoriesPath);

        assertThat(categories).isEqualTo(sampleResult().getCategories());
    }

    private static ExtractionResult sampleResult() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Drug Name", "Amoxicillin");
        row.put("Tier", "1");
        SubCategory penicillins = new SubCategory("Penicillins");
        penicillins.getRows().add(row);
        Category antibiotics = new Category("Antibiotics");
        antibiotics.getSubCategories().add(penicillins);

        return new ExtractionResult(
            List.of(antibiotics),
            List.of(
                new ExtractionWarning(4, "A B C D", WarningReason.MALFORMED_ROW, null),
                new ExtractionWarning(5, "Ampicillin 2", WarningReason.ROW_BEFORE_SUBCATEGORY, "Antibiotics")),
            List.of(new TocEntry("Antibiotics", 3), new TocEntry("Preface", "iv")),
            3);
    }
}
