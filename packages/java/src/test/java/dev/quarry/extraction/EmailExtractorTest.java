package dev.quarry.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EmailExtractor")
final class EmailExtractorTest {
    private final EmailExtractor extractor = new EmailExtractor();

    private static byte[] message(String... lines) {
        return String.join("\r\n", lines).getBytes(StandardCharsets.UTF_8);
    }

    private ExtractionResult extractEml(byte[] data) throws QuarryException {
        return extractor.extract(data, MimeTypes.EML, ExtractionConfig.defaults());
    }

    @Nested
    @DisplayName("RFC 822 messages")
    final class Rfc822Test {

        @Test
        void shouldRenderHeadersBeforeBody() throws QuarryException {
            ExtractionResult result = extractEml(message(
                "From: ada@example.com",
                "To: bob@example.com, carol@example.com",
                "Subject: Quarterly numbers",
                "Date: Mon, 02 Jan 2023 10:00:00 +0000",
                "Message-ID: <q1@example.com>",
                "Content-Type: text/plain; charset=utf-8",
                "",
                "Revenue grew by ten percent.",
                ""));

            assertThat(result.getContent())
                .startsWith("Subject: Quarterly numbers\nFrom: ada@example.com\nTo: bob@example.com, carol@example.com")
                .contains("Date: 2023-01-02T10:00:00Z")
                .endsWith("Revenue grew by ten percent.");
            assertThat(result.getMetadata().getTitle()).contains("Quarterly numbers");
            assertThat(result.getMetadata().getAuthors()).containsExactly("ada@example.com");
            assertThat(result.getMetadata().getCreatedAt()).contains("2023-01-02T10:00:00Z");
            assertThat(result.getMetadata().get("email_to"))
                .contains(List.of("bob@example.com", "carol@example.com"));
            assertThat(result.getMetadata().get("message_id")).contains("<q1@example.com>");
            assertThat(result.getMetadata().get("attachment_count")).contains(0);
        }

        @Test
        void shouldListAttachmentsByNameOnly() throws QuarryException {
            ExtractionResult result = extractEml(message(
                "From: ada@example.com",
                "To: bob@example.com",
                "Subject: Report attached",
                "MIME-Version: 1.0",
                "Content-Type: multipart/mixed; boundary=\"XYZ\"",
                "",
                "--XYZ",
                "Content-Type: text/plain; charset=utf-8",
                "",
                "See the attached report.",
                "--XYZ",
                "Content-Type: application/octet-stream",
                "Content-Disposition: attachment; filename=\"report.bin\"",
                "Content-Transfer-Encoding: base64",
                "",
                "c2VjcmV0IHBheWxvYWQ=",
                "--XYZ--",
                ""));

            assertThat(result.getContent())
                .contains("See the attached report.")
                .contains("Attachments: report.bin")
                .doesNotContain("secret payload");
            assertThat(result.getMetadata().get("attachment_count")).contains(1);
            assertThat(result.getMetadata().get("attachments")).contains(List.of("report.bin"));
        }

        @Test
        void shouldPreferPlainAlternativeOverHtml() throws QuarryException {
            ExtractionResult result = extractEml(message(
                "From: ada@example.com",
                "Subject: Two bodies",
                "MIME-Version: 1.0",
                "Content-Type: multipart/alternative; boundary=\"ALT\"",
                "",
                "--ALT",
                "Content-Type: text/plain",
                "",
                "Plain version",
                "--ALT",
                "Content-Type: text/html",
                "",
                "<p>Html version</p>",
                "--ALT--",
                ""));

            assertThat(result.getContent()).contains("Plain version").doesNotContain("Html version");
        }

        @Test
        void shouldReduceHtmlOnlyBodyToText() throws QuarryException {
            ExtractionResult result = extractEml(message(
                "From: ada@example.com",
                "Subject: Newsletter",
                "Content-Type: text/html; charset=utf-8",
                "",
                "<html><body><h1>Hello</h1><p>Welcome to <b>the list</b>.</p></body></html>",
                ""));

            assertThat(result.getContent())
                .contains("Hello\n\nWelcome to the list.")
                .doesNotContain("<p>");
        }
    }

    @Nested
    @DisplayName("Outlook messages")
    final class OutlookTest {

        @Test
        void shouldRejectBytesThatAreNotAnOutlookMessage() {
            byte[] garbage = "definitely not an OLE2 container".getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> extractor.extract(garbage, MimeTypes.MSG, ExtractionConfig.defaults()))
                .isInstanceOf(QuarryException.Parsing.class)
                .hasMessageContaining("Outlook");
        }
    }
}
