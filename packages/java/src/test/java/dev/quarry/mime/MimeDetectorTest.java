package dev.quarry.mime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.QuarryException;
import dev.quarry.TestDocuments;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Format classifier")
final class MimeDetectorTest {

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("magic signatures")
    final class MagicTest {

        @Test
        void detectsPdf() throws QuarryException {
            assertThat(MimeDetector.detect(TestDocuments.pdf("hello"))).isEqualTo(MimeTypes.PDF);
        }

        @Test
        void detectsPng() throws QuarryException {
            assertThat(MimeDetector.detect(TestDocuments.png(20, 10))).isEqualTo(MimeTypes.PNG);
        }

        @Test
        void detectsJpegAndGif() throws QuarryException {
            assertThat(MimeDetector.detect(new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00}))
                .isEqualTo(MimeTypes.JPEG);
            assertThat(MimeDetector.detect(utf8("GIF89a....."))).isEqualTo(MimeTypes.GIF);
        }

        @Test
        void detectsRtf() throws QuarryException {
            assertThat(MimeDetector.detect(utf8("{\\rtf1\\ansi Hello}"))).isEqualTo(MimeTypes.RTF);
        }

        @Test
        void reportsBareOleStorage() throws QuarryException {
            byte[] ole = new byte[512];
            int[] magic = {0xD0, 0xCF, 0x11, 0xE0, 0xA1, 0xB1, 0x1A, 0xE1};
            for (int i = 0; i < magic.length; i++) {
                ole[i] = (byte) magic[i];
            }
            assertThat(MimeDetector.detect(ole)).isEqualTo(MimeTypes.OLE_STORAGE);
            assertThat(MimeDetector.classify(ole, "legacy.doc", null).mimeType()).isEqualTo(MimeTypes.DOC);
        }
    }

    @Nested
    @DisplayName("ZIP containers")
    final class ZipTest {

        @Test
        void distinguishesOfficeFormats() throws QuarryException {
            assertThat(MimeDetector.detect(TestDocuments.docx(null, "text"))).isEqualTo(MimeTypes.DOCX);
            assertThat(MimeDetector.detect(TestDocuments.xlsx("S", List.of(List.of("a")))))
                .isEqualTo(MimeTypes.XLSX);
            assertThat(MimeDetector.detect(TestDocuments.pptx("slide"))).isEqualTo(MimeTypes.PPTX);
        }

        @Test
        void readsOpenDocumentMimetypeEntry() throws QuarryException {
            byte[] odt = TestDocuments.odf(MimeTypes.ODT, "<office:text><text:p>Hi</text:p></office:text>", null);
            assertThat(MimeDetector.detect(odt)).isEqualTo(MimeTypes.ODT);
        }

        @Test
        void plainArchiveStaysZip() throws QuarryException {
            byte[] zip = TestDocuments.zip(Map.of("notes.txt", "hello"));
            assertThat(MimeDetector.detect(zip)).isEqualTo(MimeTypes.ZIP);
        }
    }

    @Nested
    @DisplayName("text formats")
    final class TextTest {

        @Test
        void recognizesMarkupAndJson() throws QuarryException {
            assertThat(MimeDetector.detect(utf8("<!DOCTYPE html><html><body>x</body></html>")))
                .isEqualTo(MimeTypes.HTML);
            assertThat(MimeDetector.detect(utf8("<?xml version=\"1.0\"?><root/>"))).isEqualTo(MimeTypes.XML);
            assertThat(MimeDetector.detect(utf8("{\"a\": [1, 2]}"))).isEqualTo(MimeTypes.JSON);
            assertThat(MimeDetector.detect(utf8("just words"))).isEqualTo(MimeTypes.PLAIN_TEXT);
        }

        @Test
        void extensionNarrowsGenericText() throws QuarryException {
            Classification classification = MimeDetector.classify(utf8("# Title\n\nBody"), "notes.md", null);

            assertThat(classification.mimeType()).isEqualTo(MimeTypes.MARKDOWN);
            assertThat(classification.sniffedType()).isEqualTo(MimeTypes.PLAIN_TEXT);
            assertThat(classification.warnings()).isEmpty();
        }

        @Test
        void recognizesMailHeaderBlock() throws QuarryException {
            byte[] mail = utf8("Received: from mx.example.com\r\nFrom: ada@example.com\r\n"
                + "Subject: Hello\r\n\r\nBody text");

            assertThat(MimeDetector.detect(mail)).isEqualTo(MimeTypes.EML);
            assertThat(MimeDetector.detect(utf8("From the desk of Ada\nsubject to change"))).isEqualTo(
                MimeTypes.PLAIN_TEXT);
        }

        @Test
        void mapsContainerExtensions() throws QuarryException {
            assertThat(MimeDetector.detectFromPath("backup.tar")).isEqualTo(MimeTypes.TAR);
            assertThat(MimeDetector.detectFromPath("backup.7z")).isEqualTo(MimeTypes.SEVEN_Z);
            assertThat(MimeDetector.detectFromPath("analysis.ipynb")).isEqualTo(MimeTypes.IPYNB);
            assertThat(MimeDetector.detectFromPath("inbox/message.msg")).isEqualTo(MimeTypes.MSG);
            assertThat(MimeDetector.detectFromPath("old.ppt")).isEqualTo(MimeTypes.PPT);
        }

        @Test
        void declaredAliasIsCanonicalized() throws QuarryException {
            assertThat(MimeDetector.classify(utf8("a,b\n1,2\n"), null, "text/x-csv; charset=utf-8").mimeType())
                .isEqualTo(MimeTypes.CSV);
        }
    }

    @Nested
    @DisplayName("cross-checks")
    final class CrossCheckTest {

        @Test
        void contentWinsOverMismatchedDeclaration() throws QuarryException {
            Classification classification = MimeDetector.classify(TestDocuments.pdf("x"), null, "text/html");

            assertThat(classification.mimeType()).isEqualTo(MimeTypes.PDF);
            assertThat(classification.warnings())
                .singleElement()
                .satisfies(w -> assertThat(w.source()).isEqualTo("mime"));
        }

        @Test
        void contentWinsOverMisleadingExtension() throws QuarryException {
            assertThat(MimeDetector.classify(TestDocuments.pdf("x"), "report.docx", null).mimeType())
                .isEqualTo(MimeTypes.PDF);
        }

        @Test
        void classificationIsStableForItsOwnOutput() throws QuarryException {
            byte[] docx = TestDocuments.docx(null, "stable");
            String first = MimeDetector.classify(docx, null, null).mimeType();

            assertThat(MimeDetector.classify(docx, null, first).mimeType()).isEqualTo(first);
        }

        @Test
        void unknownExtensionWithoutContentFails() {
            assertThatThrownBy(() -> MimeDetector.classify(null, "archive.qqq", null))
                .isInstanceOf(QuarryException.UnsupportedFormat.class)
                .hasMessageContaining(".qqq");
        }

        @Test
        void emptyInputFails() {
            assertThatThrownBy(() -> MimeDetector.detect(new byte[0]))
                .isInstanceOf(QuarryException.UnsupportedFormat.class);
        }
    }

    @Nested
    @DisplayName("MIME tables")
    final class TablesTest {

        @Test
        void validateAcceptsBuiltInsAndImages() throws QuarryException {
            assertThat(MimeTypes.validate("Application/PDF")).isEqualTo(MimeTypes.PDF);
            assertThat(MimeTypes.validate("image/x-custom")).isEqualTo("image/x-custom");
        }

        @Test
        void validateRejectsUnknownUnlessRegistered() throws QuarryException {
            assertThatThrownBy(() -> MimeTypes.validate("application/x-unknown"))
                .isInstanceOf(QuarryException.UnsupportedFormat.class)
                .hasMessageContaining("application/x-unknown");
            assertThat(MimeTypes.validate("application/x-unknown", List.of("application/x-unknown")))
                .isEqualTo("application/x-unknown");
        }

        @Test
        void reverseLooksUpExtensions() {
            assertThat(MimeTypes.getExtensionsForMime("application/pdf")).containsExactly("pdf");
            assertThat(MimeTypes.getExtensionsForMime("application/x-nothing")).isEmpty();
        }
    }
}
