package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EPUB 2 and 3 books: the package document's Dublin Core metadata and the spine's XHTML chapters in
 * reading order.
 */
public final class EpubExtractor implements DocumentExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(EpubExtractor.class);

    private static final String CONTAINER = "META-INF/container.xml";

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        Map<String, byte[]> parts = ZipParts.read(data, name -> !name.endsWith("/"));
        byte[] container = parts.get(CONTAINER);
        if (container == null) {
            throw new QuarryException.Parsing("Not an EPUB: " + CONTAINER + " is missing");
        }
        String packagePath = rootFile(container);
        byte[] packageXml = parts.get(packagePath);
        if (packageXml == null) {
            throw new QuarryException.Parsing("EPUB package document " + packagePath + " is missing");
        }
        PackageDocument opf = readPackage(packageXml);
        String base = packagePath.contains("/") ? packagePath.substring(0, packagePath.lastIndexOf('/') + 1) : "";

        StringBuilder content = new StringBuilder();
        int chapters = 0;
        for (String idref : opf.spine) {
            String href = opf.manifest.get(idref);
            if (href == null) {
                LOG.debug("Spine item {} has no manifest entry", idref);
                continue;
            }
            byte[] chapter = parts.get(resolve(base, href));
            if (chapter == null) {
                LOG.warn("EPUB chapter {} is listed but missing from the archive", href);
                continue;
            }
            String text = HtmlExtractor.text(new String(chapter, StandardCharsets.UTF_8));
            if (!text.isEmpty()) {
                content.append(text).append("\n\n");
                chapters++;
            }
        }

        Metadata.Builder metadata = Metadata.builder()
            .title(opf.title)
            .language(opf.language)
            .createdAt(opf.date)
            .additional("chapter_count", chapters);
        if (!opf.creators.isEmpty()) {
            metadata.authors(opf.creators);
        }
        if (!opf.subjects.isEmpty()) {
            metadata.keywords(opf.subjects);
        }
        if (opf.publisher != null) {
            metadata.additional("publisher", opf.publisher);
        }
        if (opf.identifier != null) {
            metadata.additional("identifier", opf.identifier);
        }
        return ExtractionResult.builder(mimeType)
            .content(Texts.tidy(content.toString()))
            .metadata(metadata.build())
            .build();
    }

    static String rootFile(byte[] container) throws QuarryException {
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(container));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT && "rootfile".equals(reader.getLocalName())) {
                    String path = reader.getAttributeValue(null, "full-path");
                    if (path != null && !path.isBlank()) {
                        return path.trim();
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Malformed EPUB container: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        throw new QuarryException.Parsing("EPUB container names no rootfile");
    }

    static PackageDocument readPackage(byte[] xml) throws QuarryException {
        PackageDocument opf = new PackageDocument();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
            boolean inMetadata = false;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.END_ELEMENT && "metadata".equals(reader.getLocalName())) {
                    inMetadata = false;
                }
                if (event != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                String name = reader.getLocalName();
                if ("metadata".equals(name)) {
                    inMetadata = true;
                } else if (inMetadata) {
                    opf.dublinCore(name, reader);
                } else if ("item".equals(name)) {
                    String id = reader.getAttributeValue(null, "id");
                    String href = reader.getAttributeValue(null, "href");
                    if (id != null && href != null) {
                        opf.manifest.put(id, href);
                    }
                } else if ("itemref".equals(name)) {
                    String idref = reader.getAttributeValue(null, "idref");
                    if (idref != null && !"no".equals(reader.getAttributeValue(null, "linear"))) {
                        opf.spine.add(idref);
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Malformed EPUB package document: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return opf;
    }

    /** Resolve a manifest href against the package document's directory. */
    static String resolve(String base, String href) {
        String path = href;
        int fragment = path.indexOf('#');
        if (fragment >= 0) {
            path = path.substring(0, fragment);
        }
        try {
            path = new URI(null, null, "/" + base, null).resolve(new URI(path)).getPath();
        } catch (URISyntaxException e) {
            LOG.debug("Resolving raw EPUB href {}: {}", href, e.getMessage());
            path = base + path;
        }
        return path.startsWith("/") ? path.substring(1) : path;
    }

    static final class PackageDocument {
        String title;
        String language;
        String date;
        String publisher;
        String identifier;
        final List<String> creators = new ArrayList<>();
        final List<String> subjects = new ArrayList<>();
        final Map<String, String> manifest = new HashMap<>();
        final List<String> spine = new ArrayList<>();

        void dublinCore(String element, XMLStreamReader reader) throws XMLStreamException {
            switch (element) {
                case "title":
                    String title = reader.getElementText().strip();
                    if (this.title == null && !title.isEmpty()) {
                        this.title = title;
                    }
                    break;
                case "creator":
                    addIfPresent(creators, reader.getElementText());
                    break;
                case "subject":
                    addIfPresent(subjects, reader.getElementText());
                    break;
                case "language":
                    language = firstOf(language, reader.getElementText());
                    break;
                case "date":
                    date = firstOf(date, reader.getElementText());
                    break;
                case "publisher":
                    publisher = firstOf(publisher, reader.getElementText());
                    break;
                case "identifier":
                    identifier = firstOf(identifier, reader.getElementText());
                    break;
                default:
                    break;
            }
        }

        private static void addIfPresent(List<String> values, String value) {
            if (value != null && !value.isBlank()) {
                values.add(value.strip());
            }
        }

        private static String firstOf(String current, String value) {
            if (current != null || value == null || value.isBlank()) {
                return current;
            }
            return value.strip();
        }
    }
}
