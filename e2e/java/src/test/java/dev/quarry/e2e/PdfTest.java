package dev.quarry.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quarry.PageContent;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** PDF fixtures. */
public class PdfTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void pdfMultiPage() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "pdf_multi_page",
            "pdfs/three_pages.pdf",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertContentContainsAll(result,
                    Arrays.asList("Chapter one", "Chapter two", "Chapter three"));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "page_count", Map.of("eq", 3));
                assertTrue(result.getPages().isEmpty(), "Pages are only kept when requested");
            }
        );
    }

    @Test
    public void pdfExtractPages() throws Exception {
        JsonNode config = MAPPER.readTree("{\"pages\":{\"extract_pages\":true}}");
        E2EHelpers.runFixture(
            "pdf_extract_pages",
            "pdfs/three_pages.pdf",
            config,
            Collections.emptyList(),
            null,
            result -> {
                assertEquals(3, result.getPages().size());
                PageContent second = result.getPages().get(1);
                assertEquals(2, second.pageNumber());
                assertTrue(second.content().contains("Chapter two"));
            }
        );
    }

    @Test
    public void pdfPageMarkers() throws Exception {
        JsonNode config = MAPPER.readTree("{\"pages\":{\"insert_page_markers\":true}}");
        E2EHelpers.runFixture(
            "pdf_page_markers",
            "pdfs/three_pages.pdf",
            config,
            Collections.emptyList(),
            null,
            result -> E2EHelpers.Assertions.assertContentContainsAll(result,
                Arrays.asList("<!-- PAGE 1 -->", "<!-- PAGE 3 -->"))
        );
    }
}
