package dev.quarry.e2e;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/** Email fixtures. */
public class EmailTest {

    @Test
    public void emailSampleEml() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "email_sample_eml",
            "email/sample_email.eml",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertExpectedMime(result, Arrays.asList("message/rfc822"));
                E2EHelpers.Assertions.assertMinContentLength(result, 20);
                E2EHelpers.Assertions.assertContentContainsAll(result,
                    Arrays.asList("Notes on the Analytical Engine", "elaborate pieces of music"));
            }
        );
    }

    @Test
    public void emailSampleEmlHeaders() throws Exception {
        JsonNode config = null;
        E2EHelpers.runFixture(
            "email_sample_eml_headers",
            "email/sample_email.eml",
            config,
            Collections.emptyList(),
            null,
            result -> {
                E2EHelpers.Assertions.assertMetadataExpectation(result, "title",
                    Map.of("eq", "Notes on the Analytical Engine"));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "email_to",
                    Map.of("contains", Arrays.asList("Charles Babbage <charles@example.com>")));
                E2EHelpers.Assertions.assertMetadataExpectation(result, "message_id",
                    Map.of("contains", "notes-1843"));
            }
        );
    }
}
