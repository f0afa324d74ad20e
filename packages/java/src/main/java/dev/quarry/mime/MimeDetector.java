package dev.quarry.mime;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.io.JsonEOFException;
import dev.quarry.ProcessingWarning;
import dev.quarry.QuarryException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Format classifier: content sniffing first, then extension, with the declared type cross-checked.
 *
 * <p>The sniffed type wins over the extension whenever it is specific. A generic container
 * (plain text, bare ZIP, OLE storage, bare XML) may be narrowed by the extension or the
 * declared type within the same family, never across families.</p>
 */
public final class MimeDetector {
    private static final Logger LOG = LoggerFactory.getLogger(MimeDetector.class);

    /** Bytes inspected by the text sniffers. ZIP disambiguation uses the whole buffer. */
    public static final int SNIFF_LENGTH = 8192;

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private static final String[] LEADING_MAIL_HEADERS = {
        "return-path:", "received:", "from:", "mime-version:", "message-id:", "delivered-to:", "date:", "subject:"};

    private MimeDetector() {
    }

    /**
     * Classify a document.
     *
     * @param prefix leading bytes of the document (the whole document for ZIP disambiguation)
     * @param pathHint file name or path, may be null
     * @param declaredMime caller-declared type, may be null
     * @return canonical media type and any cross-check warnings
     * @throws QuarryException.UnsupportedFormat if no type can be determined
     */
    public static Classification classify(byte[] prefix, String pathHint, String declaredMime)
        throws QuarryException.UnsupportedFormat {
        byte[] bytes = prefix != null ? prefix : new byte[0];
        String sniffed = sniff(bytes);
        String fromExtension = MimeTypes.fromPath(pathHint).orElse(null);
        String declared = MimeTypes.canonicalize(declaredMime);
        List<ProcessingWarning> warnings = new ArrayList<>();

        String candidate;
        if (sniffed == null) {
            candidate = fromExtension;
        } else if (MimeTypes.isGeneric(sniffed) && fromExtension != null
            && MimeTypes.familyOf(fromExtension) == MimeTypes.familyOf(sniffed)) {
            candidate = fromExtension;
        } else {
            candidate = sniffed;
            if (fromExtension != null && !sniffed.equals(fromExtension) && !MimeTypes.isGeneric(sniffed)
                && MimeTypes.familyOf(fromExtension) != MimeTypes.familyOf(sniffed)) {
                LOG.debug("Extension of {} suggests {} but content is {}", pathHint, fromExtension, sniffed);
            }
        }

        if (declared != null) {
            if (candidate == null) {
                candidate = declared;
            } else if (!declared.equals(candidate)) {
                if (isConsistent(declared, candidate)) {
                    candidate = declared;
                } else {
                    String message = "Declared MIME type " + declared + " does not match detected content "
                        + candidate + "; using " + candidate;
                    LOG.debug(message);
                    warnings.add(new ProcessingWarning("mime", message));
                }
            }
        }

        if (candidate == null) {
            if (pathHint != null && MimeTypes.extensionOf(pathHint) != null) {
                throw new QuarryException.UnsupportedFormat(
                    "Unknown extension: ." + MimeTypes.extensionOf(pathHint));
            }
            throw new QuarryException.UnsupportedFormat("Unable to determine MIME type from content");
        }
        return new Classification(candidate, sniffed, warnings);
    }

    /**
     * Detect a MIME type from content alone.
     *
     * @param data document bytes
     * @return canonical media type
     * @throws QuarryException.UnsupportedFormat if the bytes are not recognized
     */
    public static String detect(byte[] data) throws QuarryException.UnsupportedFormat {
        return classify(data, null, null).mimeType();
    }

    /**
     * Detect a MIME type from the file name alone.
     *
     * @param path file name or path
     * @return canonical media type
     * @throws QuarryException.UnsupportedFormat if the extension is unknown
     */
    public static String detectFromPath(String path) throws QuarryException.UnsupportedFormat {
        return classify(null, path, null).mimeType();
    }

    private static boolean isConsistent(String declared, String candidate) {
        MimeTypes.Family family = MimeTypes.familyOf(candidate);
        if (family != MimeTypes.familyOf(declared)) {
            return false;
        }
        return MimeTypes.isGeneric(candidate) || family == MimeTypes.Family.TEXT;
    }

    /**
     * Recognize a type from magic bytes and text structure.
     *
     * @param data leading bytes
     * @return canonical type, or null if inconclusive
     */
    static String sniff(byte[] data) {
        if (data.length == 0) {
            return null;
        }
        String binary = sniffBinary(data);
        if (binary != null) {
            return binary;
        }
        return sniffText(data);
    }

    private static String sniffBinary(byte[] data) {
        if (indexOf(data, "%PDF-".getBytes(StandardCharsets.US_ASCII), 1024) >= 0) {
            return MimeTypes.PDF;
        }
        if (startsWith(data, 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A)) {
            return MimeTypes.PNG;
        }
        if (startsWith(data, 0xFF, 0xD8, 0xFF)) {
            return MimeTypes.JPEG;
        }
        if (startsWith(data, 'G', 'I', 'F', '8', '7', 'a') || startsWith(data, 'G', 'I', 'F', '8', '9', 'a')) {
            return MimeTypes.GIF;
        }
        if (startsWith(data, 'I', 'I', '*', 0) || startsWith(data, 'M', 'M', 0, '*')) {
            return MimeTypes.TIFF;
        }
        if (data.length >= 12 && startsWith(data, 'R', 'I', 'F', 'F')
            && data[8] == 'W' && data[9] == 'E' && data[10] == 'B' && data[11] == 'P') {
            return MimeTypes.WEBP;
        }
        if (startsWith(data, 0x00, 0x00, 0x00, 0x0C, 'j', 'P', ' ', ' ')) {
            return MimeTypes.JP2;
        }
        if (startsWith(data, 'P', 'K', 3, 4) || startsWith(data, 'P', 'K', 5, 6)) {
            return classifyZip(data);
        }
        if (startsWith(data, 0xD0, 0xCF, 0x11, 0xE0, 0xA1, 0xB1, 0x1A, 0xE1)) {
            return MimeTypes.OLE_STORAGE;
        }
        if (startsWith(data, '{', '\\', 'r', 't', 'f')) {
            return MimeTypes.RTF;
        }
        if (startsWith(data, 0x1F, 0x8B)) {
            return MimeTypes.GZIP;
        }
        if (startsWith(data, '7', 'z', 0xBC, 0xAF, 0x27, 0x1C)) {
            return MimeTypes.SEVEN_Z;
        }
        if (isTar(data)) {
            return MimeTypes.TAR;
        }
        // BMP last: "BM" is also a plausible start of a text file.
        if (data.length >= 26 && startsWith(data, 'B', 'M') && data[6] == 0 && data[7] == 0
            && data[8] == 0 && data[9] == 0) {
            return MimeTypes.BMP;
        }
        return null;
    }

    static String classifyZip(byte[] data) {
        String storedMimetype = ZipEntryNames.storedMimetype(data);
        if (storedMimetype != null) {
            String canonical = MimeTypes.canonicalize(storedMimetype);
            if (MimeTypes.ODT.equals(canonical) || MimeTypes.ODS.equals(canonical)
                || MimeTypes.ODP.equals(canonical) || MimeTypes.EPUB.equals(canonical)) {
                return canonical;
            }
        }
        List<String> names = ZipEntryNames.read(data);
        boolean contentTypes = false;
        for (String name : names) {
            if (name.startsWith("word/")) {
                return MimeTypes.DOCX;
            }
            if (name.startsWith("xl/")) {
                return names.contains("xl/vbaProject.bin") ? MimeTypes.XLSM : MimeTypes.XLSX;
            }
            if (name.startsWith("ppt/")) {
                return MimeTypes.PPTX;
            }
            if ("[Content_Types].xml".equals(name)) {
                contentTypes = true;
            }
        }
        if (contentTypes) {
            return MimeTypes.OOXML;
        }
        return MimeTypes.ZIP;
    }

    private static String sniffText(byte[] data) {
        int length = Math.min(data.length, SNIFF_LENGTH);
        if (!isUtf8Text(data, length)) {
            return null;
        }
        int start = 0;
        if (length >= 3 && (data[0] & 0xFF) == 0xEF && (data[1] & 0xFF) == 0xBB && (data[2] & 0xFF) == 0xBF) {
            start = 3;
        }
        while (start < length && Character.isWhitespace(data[start])) {
            start++;
        }
        if (start == length) {
            return MimeTypes.PLAIN_TEXT;
        }
        String head = new String(data, start, Math.min(length - start, 1024), StandardCharsets.UTF_8)
            .toLowerCase(Locale.ROOT);
        if (head.startsWith("<")) {
            String markup = markupType(head);
            if (markup != null) {
                return markup;
            }
        }
        if ((data[start] == '{' || data[start] == '[') && looksLikeJson(data, start, length)) {
            if (head.contains("\"cells\"") && (head.contains("\"cell_type\"") || head.contains("\"nbformat\""))) {
                return MimeTypes.IPYNB;
            }
            return MimeTypes.JSON;
        }
        if (looksLikeMail(head)) {
            return MimeTypes.EML;
        }
        return MimeTypes.PLAIN_TEXT;
    }

    /** POSIX and GNU tar both carry "ustar" at offset 257 of the first header block. */
    public static boolean isTar(byte[] data) {
        byte[] magic = "ustar".getBytes(StandardCharsets.US_ASCII);
        if (data.length < 257 + magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (data[257 + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    /** An RFC 822 header block: starts with a mail header and names both a sender and a subject or id. */
    private static boolean looksLikeMail(String head) {
        boolean leading = false;
        for (String header : LEADING_MAIL_HEADERS) {
            if (head.startsWith(header)) {
                leading = true;
                break;
            }
        }
        return leading && hasHeaderLine(head, "from:")
            && (hasHeaderLine(head, "subject:") || hasHeaderLine(head, "message-id:"));
    }

    private static boolean hasHeaderLine(String head, String name) {
        return head.startsWith(name) || head.contains("\n" + name);
    }

    private static String markupType(String head) {
        String body = head;
        if (body.startsWith("<?xml")) {
            int end = body.indexOf("?>");
            body = end >= 0 ? body.substring(end + 2).stripLeading() : "";
            while (body.startsWith("<!--")) {
                int close = body.indexOf("-->");
                body = close >= 0 ? body.substring(close + 3).stripLeading() : "";
            }
            if (body.startsWith("<!doctype html") || body.startsWith("<html")) {
                return MimeTypes.XHTML;
            }
            if (body.startsWith("<svg") || body.startsWith("<!doctype svg")) {
                return MimeTypes.SVG;
            }
            return MimeTypes.XML;
        }
        if (body.startsWith("<!doctype html") || body.startsWith("<html") || body.startsWith("<head")
            || body.startsWith("<body")) {
            return MimeTypes.HTML;
        }
        if (body.startsWith("<svg")) {
            return MimeTypes.SVG;
        }
        return null;
    }

    private static boolean looksLikeJson(byte[] data, int start, int length) {
        try (JsonParser parser = JSON_FACTORY.createParser(data, start, length - start)) {
            while (parser.nextToken() != null) {
                if (parser.getParsingContext().inRoot() && parser.currentToken().isStructEnd()) {
                    return true;
                }
            }
            return true;
        } catch (JsonEOFException e) {
            // truncated prefix of a JSON document
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean isUtf8Text(byte[] data, int length) {
        for (int i = 0; i < length; i++) {
            if (data[i] == 0) {
                return false;
            }
        }
        int end = length;
        if (length < data.length) {
            // the cut may split a multi-byte sequence
            int back = 0;
            while (back < 3 && end > 0 && (data[end - 1] & 0xC0) == 0x80) {
                end--;
                back++;
            }
            if (end > 0 && (data[end - 1] & 0xC0) == 0xC0) {
                end--;
            }
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(data, 0, end));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    private static boolean startsWith(byte[] data, int... signature) {
        if (data.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((data[i] & 0xFF) != (signature[i] & 0xFF)) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] data, byte[] needle, int window) {
        int limit = Math.min(data.length, window) - needle.length;
        outer:
        for (int i = 0; i <= limit; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
