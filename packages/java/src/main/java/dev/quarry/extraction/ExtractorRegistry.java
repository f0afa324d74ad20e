package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import dev.quarry.plugins.PluginInvoker;
import dev.quarry.plugins.PluginKind;
import dev.quarry.plugins.PluginRegistration;
import dev.quarry.plugins.PluginRegistry;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a canonical MIME type to the extractor that handles it.
 *
 * <p>Document extractors registered as plugins for a type take precedence over the built-in
 * extractor for that type, highest priority first. The built-ins are stateless and shared.</p>
 */
public final class ExtractorRegistry {
    private final PluginRegistry plugins;
    private final Map<String, DocumentExtractor> builtIns;
    private final ImageExtractor images = new ImageExtractor();

    public ExtractorRegistry(PluginRegistry plugins) {
        this(plugins, SizingGuard.defaults());
    }

    public ExtractorRegistry(PluginRegistry plugins, SizingGuard guard) {
        this.plugins = Objects.requireNonNull(plugins, "plugins must not be null");
        Map<String, DocumentExtractor> map = new HashMap<>();
        PlainTextExtractor text = new PlainTextExtractor();
        for (String mime : new String[] {
            MimeTypes.PLAIN_TEXT, MimeTypes.YAML, MimeTypes.TOML, MimeTypes.RST, MimeTypes.ORG}) {
            map.put(mime, text);
        }
        map.put(MimeTypes.MARKDOWN, new MarkdownExtractor());
        HtmlExtractor html = new HtmlExtractor();
        map.put(MimeTypes.HTML, html);
        map.put(MimeTypes.XHTML, html);
        CsvExtractor csv = new CsvExtractor();
        map.put(MimeTypes.CSV, csv);
        map.put(MimeTypes.TSV, csv);
        map.put(MimeTypes.JSON, new JsonExtractor());
        XmlExtractor xml = new XmlExtractor();
        map.put(MimeTypes.XML, xml);
        map.put(MimeTypes.TEXT_XML, xml);
        map.put(MimeTypes.SVG, xml);
        map.put(MimeTypes.RTF, new RtfExtractor());
        map.put(MimeTypes.PDF, new PdfExtractor());
        map.put(MimeTypes.DOCX, new DocxExtractor());
        XlsxExtractor xlsx = new XlsxExtractor(guard);
        map.put(MimeTypes.XLSX, xlsx);
        map.put(MimeTypes.XLSM, xlsx);
        PptxExtractor pptx = new PptxExtractor();
        map.put(MimeTypes.PPTX, pptx);
        map.put(MimeTypes.PPSX, pptx);
        map.put(MimeTypes.PPTM, pptx);
        OdfExtractor odf = new OdfExtractor(guard);
        map.put(MimeTypes.ODT, odf);
        map.put(MimeTypes.ODS, odf);
        map.put(MimeTypes.ODP, odf);
        OleExtractor ole = new OleExtractor();
        for (String mime : new String[] {MimeTypes.DOC, MimeTypes.XLS, MimeTypes.PPT, MimeTypes.OLE_STORAGE}) {
            map.put(mime, ole);
        }
        EmailExtractor email = new EmailExtractor();
        map.put(MimeTypes.EML, email);
        map.put(MimeTypes.MSG, email);
        map.put(MimeTypes.EPUB, new EpubExtractor());
        map.put(MimeTypes.IPYNB, new JupyterExtractor());
        map.put(MimeTypes.LATEX, new LatexExtractor());
        ArchiveExtractor archives = new ArchiveExtractor(this);
        for (String mime : new String[] {MimeTypes.ZIP, MimeTypes.TAR, MimeTypes.GZIP, MimeTypes.SEVEN_Z}) {
            map.put(mime, archives);
        }
        this.builtIns = Collections.unmodifiableMap(map);
    }

    /**
     * Find the extractor for a MIME type.
     *
     * @param mimeType MIME type, canonicalized here
     * @return the plugin extractor claiming the type, else the built-in one
     * @throws QuarryException.UnsupportedFormat if nothing handles the type
     */
    public Resolved resolve(String mimeType) throws QuarryException.UnsupportedFormat {
        String canonical = MimeTypes.canonicalize(mimeType);
        if (canonical == null) {
            throw new QuarryException.UnsupportedFormat("MIME type must not be blank");
        }
        for (PluginRegistration<DocumentExtractor> registration : plugins.documentExtractors().snapshot()) {
            if (registration.mimeTypes().contains(canonical)) {
                return new Resolved(registration.name(), registration.plugin(), true);
            }
        }
        return builtIn(canonical)
            .map(extractor -> new Resolved(extractor.getClass().getSimpleName(), extractor, false))
            .orElseThrow(() -> new QuarryException.UnsupportedFormat("Unsupported MIME type: " + canonical));
    }

    /**
     * The built-in extractor for a canonical type, ignoring plugins.
     *
     * @param canonical canonical MIME type
     * @return extractor, or empty
     */
    public Optional<DocumentExtractor> builtIn(String canonical) {
        DocumentExtractor extractor = builtIns.get(canonical);
        if (extractor == null && canonical != null && canonical.startsWith("image/")) {
            return Optional.of(images);
        }
        return Optional.ofNullable(extractor);
    }

    /**
     * Every type some extractor handles: the built-ins plus whatever plugins claim.
     * Any {@code image/*} is handled as well.
     *
     * @return supported canonical types
     */
    public Set<String> supportedMimeTypes() {
        Set<String> types = new LinkedHashSet<>(builtIns.keySet());
        for (PluginRegistration<DocumentExtractor> registration : plugins.documentExtractors().snapshot()) {
            types.addAll(registration.mimeTypes());
        }
        return Collections.unmodifiableSet(types);
    }

    /** An extractor chosen for one MIME type. */
    public static final class Resolved {
        private final String name;
        private final DocumentExtractor extractor;
        private final boolean plugin;

        Resolved(String name, DocumentExtractor extractor, boolean plugin) {
            this.name = name;
            this.extractor = extractor;
            this.plugin = plugin;
        }

        public String name() {
            return name;
        }

        public DocumentExtractor extractor() {
            return extractor;
        }

        public boolean isPlugin() {
            return plugin;
        }

        /**
         * Run the extractor. Plugin extractors are invoked through {@link PluginInvoker}, so
         * anything they throw besides a typed {@link QuarryException} becomes a {@code Plugin} error.
         *
         * @param data document bytes
         * @param mimeType canonical MIME type
         * @param config effective configuration
         * @return raw extraction, never null
         * @throws QuarryException if extraction fails
         */
        public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
            if (!plugin) {
                return extractor.extract(data, mimeType, config);
            }
            ExtractionResult result = PluginInvoker.invoke(PluginKind.DOCUMENT_EXTRACTOR, name,
                () -> extractor.extract(data, mimeType, config));
            if (result == null) {
                throw new QuarryException.Plugin(name, "Document extractor '" + name + "' returned no result");
            }
            return result;
        }

        public Optional<PageRenderer> pageRenderer() {
            return extractor instanceof PageRenderer ? Optional.of((PageRenderer) extractor) : Optional.empty();
        }

        public Optional<MarkdownRendering> markdownRendering() {
            return extractor instanceof MarkdownRendering
                ? Optional.of((MarkdownRendering) extractor) : Optional.empty();
        }
    }
}
