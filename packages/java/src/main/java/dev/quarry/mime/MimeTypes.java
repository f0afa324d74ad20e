package dev.quarry.mime;

import dev.quarry.QuarryException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MIME constants, the extension table, aliases and the set of types with a built-in extractor.
 */
public final class MimeTypes {
    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String PLAIN_TEXT = "text/plain";
    public static final String MARKDOWN = "text/markdown";
    public static final String HTML = "text/html";
    public static final String XHTML = "application/xhtml+xml";
    public static final String CSV = "text/csv";
    public static final String TSV = "text/tab-separated-values";
    public static final String JSON = "application/json";
    public static final String XML = "application/xml";
    public static final String TEXT_XML = "text/xml";
    public static final String YAML = "application/x-yaml";
    public static final String TOML = "application/toml";
    public static final String RST = "text/x-rst";
    public static final String ORG = "text/x-org";
    public static final String RTF = "application/rtf";
    public static final String SVG = "image/svg+xml";
    public static final String PDF = "application/pdf";
    public static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    public static final String XLSM = "application/vnd.ms-excel.sheet.macroenabled.12";
    public static final String PPTX = "application/vnd.openxmlformats-officedocument.presentationml.presentation";
    public static final String PPSX = "application/vnd.openxmlformats-officedocument.presentationml.slideshow";
    public static final String PPTM = "application/vnd.ms-powerpoint.presentation.macroenabled.12";
    public static final String OOXML = "application/x-ooxml";
    public static final String ODT = "application/vnd.oasis.opendocument.text";
    public static final String ODS = "application/vnd.oasis.opendocument.spreadsheet";
    public static final String ODP = "application/vnd.oasis.opendocument.presentation";
    public static final String EPUB = "application/epub+zip";
    public static final String ZIP = "application/zip";
    public static final String GZIP = "application/gzip";
    public static final String TAR = "application/x-tar";
    public static final String SEVEN_Z = "application/x-7z-compressed";
    public static final String OLE_STORAGE = "application/x-ole-storage";
    public static final String DOC = "application/msword";
    public static final String XLS = "application/vnd.ms-excel";
    public static final String PPT = "application/vnd.ms-powerpoint";
    public static final String MSG = "application/vnd.ms-outlook";
    public static final String EML = "message/rfc822";
    public static final String IPYNB = "application/x-ipynb+json";
    public static final String LATEX = "application/x-latex";
    public static final String PNG = "image/png";
    public static final String JPEG = "image/jpeg";
    public static final String GIF = "image/gif";
    public static final String BMP = "image/bmp";
    public static final String TIFF = "image/tiff";
    public static final String WEBP = "image/webp";
    public static final String JP2 = "image/jp2";

    /** Coarse groups used to decide whether two types may replace each other. */
    public enum Family {
        TEXT, ZIP, OLE, PDF, IMAGE, RTF, GZIP, ARCHIVE, OTHER
    }

    private static final Map<String, String> EXTENSIONS;
    private static final Map<String, String> ALIASES;
    private static final Set<String> BUILT_IN;
    private static final Set<String> GENERIC = Set.of(PLAIN_TEXT, ZIP, OLE_STORAGE, XML, OOXML);
    private static final Set<String> ZIP_TYPES = Set.of(
        ZIP, DOCX, XLSX, XLSM, PPTX, PPSX, PPTM, OOXML, ODT, ODS, ODP, EPUB);
    private static final Set<String> OLE_TYPES = Set.of(OLE_STORAGE, DOC, XLS, PPT, MSG);
    private static final Set<String> TEXT_APPLICATION_TYPES = Set.of(
        JSON, XML, XHTML, YAML, TOML, IPYNB, LATEX, EML,
        "application/docbook+xml", "application/x-bibtex");

    static {
        Map<String, String> ext = new LinkedHashMap<>();
        ext.put("txt", PLAIN_TEXT);
        ext.put("text", PLAIN_TEXT);
        ext.put("log", PLAIN_TEXT);
        ext.put("md", MARKDOWN);
        ext.put("markdown", MARKDOWN);
        ext.put("html", HTML);
        ext.put("htm", HTML);
        ext.put("xhtml", XHTML);
        ext.put("csv", CSV);
        ext.put("tsv", TSV);
        ext.put("json", JSON);
        ext.put("xml", XML);
        ext.put("yaml", YAML);
        ext.put("yml", YAML);
        ext.put("toml", TOML);
        ext.put("rst", RST);
        ext.put("org", ORG);
        ext.put("rtf", RTF);
        ext.put("svg", SVG);
        ext.put("pdf", PDF);
        ext.put("docx", DOCX);
        ext.put("xlsx", XLSX);
        ext.put("xlsm", XLSM);
        ext.put("pptx", PPTX);
        ext.put("ppsx", PPSX);
        ext.put("pptm", PPTM);
        ext.put("odt", ODT);
        ext.put("ods", ODS);
        ext.put("odp", ODP);
        ext.put("epub", EPUB);
        ext.put("zip", ZIP);
        ext.put("gz", GZIP);
        ext.put("tgz", GZIP);
        ext.put("tar", TAR);
        ext.put("7z", SEVEN_Z);
        ext.put("doc", DOC);
        ext.put("xls", XLS);
        ext.put("ppt", PPT);
        ext.put("msg", MSG);
        ext.put("eml", EML);
        ext.put("png", PNG);
        ext.put("jpg", JPEG);
        ext.put("jpeg", JPEG);
        ext.put("gif", GIF);
        ext.put("bmp", BMP);
        ext.put("tif", TIFF);
        ext.put("tiff", TIFF);
        ext.put("webp", WEBP);
        ext.put("jp2", JP2);
        ext.put("ipynb", IPYNB);
        ext.put("tex", LATEX);
        ext.put("latex", LATEX);
        ext.put("bib", "application/x-bibtex");
        ext.put("dbk", "application/docbook+xml");
        EXTENSIONS = Collections.unmodifiableMap(ext);

        Map<String, String> aliases = new HashMap<>();
        aliases.put("application/x-pdf", PDF);
        aliases.put("application/acrobat", PDF);
        aliases.put("text/x-markdown", MARKDOWN);
        aliases.put("text/x-gfm", MARKDOWN);
        aliases.put("text/x-commonmark", MARKDOWN);
        aliases.put("text/json", JSON);
        aliases.put("application/csv", CSV);
        aliases.put("text/x-csv", CSV);
        aliases.put("text/tsv", TSV);
        aliases.put("text/yaml", YAML);
        aliases.put("text/x-yaml", YAML);
        aliases.put("application/yaml", YAML);
        aliases.put("text/toml", TOML);
        aliases.put("text/rtf", RTF);
        aliases.put("text/x-org", ORG);
        aliases.put("text/org", ORG);
        aliases.put("text/prs.fallenstein.rst", RST);
        aliases.put("application/x-zip-compressed", ZIP);
        aliases.put("application/x-gzip", GZIP);
        aliases.put("image/jpg", JPEG);
        aliases.put("image/pjpeg", JPEG);
        aliases.put("image/x-ms-bmp", BMP);
        aliases.put("image/x-bmp", BMP);
        aliases.put("image/x-tiff", TIFF);
        aliases.put("application/x-epub+zip", EPUB);
        aliases.put("application/vnd.epub+zip", EPUB);
        aliases.put("application/x-gtar", TAR);
        aliases.put("application/x-7z", SEVEN_Z);
        aliases.put("application/x-tex", LATEX);
        aliases.put("text/x-tex", LATEX);
        aliases.put("text/x-latex", LATEX);
        aliases.put("application/x-ipynb", IPYNB);
        aliases.put("application/x-msg", MSG);
        aliases.put("application/x-ms-msg", MSG);
        aliases.put("message/x-emlx", EML);
        aliases.put("application/vnd.ms-word", DOC);
        aliases.put("application/x-msexcel", XLS);
        aliases.put("application/mspowerpoint", PPT);
        ALIASES = Collections.unmodifiableMap(aliases);

        BUILT_IN = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
            PLAIN_TEXT, MARKDOWN, HTML, XHTML, CSV, TSV, JSON, XML, TEXT_XML, YAML, TOML, RST, ORG, RTF, SVG,
            PDF, DOCX, XLSX, XLSM, PPTX, PPSX, PPTM, ODT, ODS, ODP,
            DOC, XLS, PPT, OLE_STORAGE, EML, MSG, EPUB, ZIP, GZIP, TAR, SEVEN_Z, IPYNB, LATEX)));
    }

    private MimeTypes() {
    }

    /**
     * Lower-cases, strips parameters and resolves aliases.
     *
     * @param mimeType raw MIME type, e.g. {@code "Text/X-Markdown; charset=utf-8"}
     * @return canonical MIME type, or null for null/blank input
     */
    public static String canonicalize(String mimeType) {
        if (mimeType == null) {
            return null;
        }
        String value = mimeType.trim().toLowerCase(Locale.ROOT);
        int semicolon = value.indexOf(';');
        if (semicolon >= 0) {
            value = value.substring(0, semicolon).trim();
        }
        if (value.isEmpty()) {
            return null;
        }
        return ALIASES.getOrDefault(value, value);
    }

    /**
     * Validate a MIME type against the built-in extractors.
     *
     * @param mimeType the MIME type to validate
     * @return canonical form
     * @throws QuarryException.UnsupportedFormat if no built-in extractor handles it
     */
    public static String validate(String mimeType) throws QuarryException.UnsupportedFormat {
        return validate(mimeType, Set.of());
    }

    /**
     * Validate a MIME type, also accepting types claimed by registered extractors.
     *
     * @param mimeType the MIME type to validate
     * @param additional extra supported types, already canonical
     * @return canonical form
     * @throws QuarryException.UnsupportedFormat if nothing handles it
     */
    public static String validate(String mimeType, Collection<String> additional)
        throws QuarryException.UnsupportedFormat {
        String canonical = canonicalize(mimeType);
        if (canonical == null) {
            throw new QuarryException.UnsupportedFormat("MIME type must not be blank");
        }
        if (BUILT_IN.contains(canonical) || canonical.startsWith("image/") || additional.contains(canonical)) {
            return canonical;
        }
        throw new QuarryException.UnsupportedFormat("Unsupported MIME type: " + canonical);
    }

    /**
     * Types handled by a built-in extractor; any {@code image/*} type is handled as well.
     *
     * @return supported types
     */
    public static Set<String> builtInTypes() {
        return BUILT_IN;
    }

    /**
     * Look up the MIME type for a file name or path by its extension.
     *
     * @param path file name or path
     * @return MIME type, or empty if the extension is unknown
     */
    public static Optional<String> fromPath(String path) {
        String extension = extensionOf(path);
        if (extension == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(EXTENSIONS.get(extension));
    }

    /**
     * Reverse lookup of the extension table.
     *
     * @param mimeType MIME type, any alias accepted
     * @return extensions without dot, in table order; empty if none
     */
    public static List<String> getExtensionsForMime(String mimeType) {
        String canonical = canonicalize(mimeType);
        List<String> extensions = new ArrayList<>();
        if (canonical == null) {
            return extensions;
        }
        for (Map.Entry<String, String> entry : EXTENSIONS.entrySet()) {
            if (entry.getValue().equals(canonical)) {
                extensions.add(entry.getKey());
            }
        }
        return extensions;
    }

    public static Family familyOf(String mimeType) {
        String canonical = canonicalize(mimeType);
        if (canonical == null) {
            return Family.OTHER;
        }
        if (ZIP_TYPES.contains(canonical)) {
            return Family.ZIP;
        }
        if (OLE_TYPES.contains(canonical)) {
            return Family.OLE;
        }
        if (PDF.equals(canonical)) {
            return Family.PDF;
        }
        if (RTF.equals(canonical)) {
            return Family.RTF;
        }
        if (GZIP.equals(canonical)) {
            return Family.GZIP;
        }
        if (TAR.equals(canonical) || SEVEN_Z.equals(canonical)) {
            return Family.ARCHIVE;
        }
        if (SVG.equals(canonical)) {
            return Family.TEXT;
        }
        if (canonical.startsWith("image/")) {
            return Family.IMAGE;
        }
        if (canonical.startsWith("text/") || TEXT_APPLICATION_TYPES.contains(canonical)) {
            return Family.TEXT;
        }
        return Family.OTHER;
    }

    /**
     * Whether a sniffed type only names a container, so an extension or declaration may narrow it.
     *
     * @param mimeType canonical type
     * @return true for plain text, bare ZIP, bare OLE storage and bare XML
     */
    public static boolean isGeneric(String mimeType) {
        return GENERIC.contains(mimeType);
    }

    static String extensionOf(String path) {
        if (path == null) {
            return null;
        }
        String name = path;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
