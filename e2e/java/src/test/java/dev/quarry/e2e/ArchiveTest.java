package dev.quarry.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/** Archive fixtures. */
public class ArchiveTest {

    @Test
    public void archiveZipBasic() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "archive_zip_basic",
            "archives/documents.zip",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertExpectedMime(result, Arrays.asList("application/zip"));
                E2EHelpers.Assertions.assertMinContentLength(result, 10);
                E2EHelpers.Assertions.assertContentContainsAll(result,
                    Arrays.asList("notes/readme.txt", "difference engine", "Ada"));
            }
        );
    }

    @Test
    public void archiveZipMetadata() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "archive_zip_metadata",
            "archives/documents.zip",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertMetadataExpectation(result, "format", Map.of("eq", "zip"));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "file_count", Map.of("gte", 2));
            }
        );
    }
}
