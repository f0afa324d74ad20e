package dev.quarry.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Office document fixtures. */
public class OfficeTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void officeDocxTable() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "office_docx_table",
            "office/table.docx",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertTableCount(result, 1, 1);
                E2EHelpers.Assertions.assertContentContainsAll(result, Arrays.asList("Region", "North", "950"));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "table_count", Map.of("eq", 1));
            }
        );
    }

    @Test
    public void officeXlsxMarkdownTable() throws Exception {
        JsonNode config = MAPPER.readTree("{\"output_format\":\"markdown\"}");
        E2EHelpers.runFixture(
            "office_xlsx_markdown_table",
            "office/stanley_cups.xlsx",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertContentContainsAll(result,
                    Arrays.asList("| Team | Location | Stanley Cups |", "| Maple Leafs | TOR | 13 |"));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "sheet_names",
                    Map.of("contains", List.of("Stanley Cups")));
            }
        );
    }

    @Test
    public void officePptxSlides() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "office_pptx_slides",
            "office/slides.pptx",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertExpectedMime(result, Arrays.asList("presentationml"));
                E2EHelpers.Assertions.assertContentContainsAll(result, Arrays.asList("roadmap", "Milestones"));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "page_count", Map.of("eq", 2));
            }
        );
    }
}
