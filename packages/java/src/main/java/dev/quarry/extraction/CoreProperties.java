package dev.quarry.extraction;

import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * OPC core properties ({@code docProps/core.xml}) for packages read without POI.
 */
final class CoreProperties {
    private CoreProperties() {
    }

    static Metadata.Builder read(byte[] xml) throws QuarryException {
        Metadata.Builder metadata = Metadata.builder();
        XMLStreamReader reader = null;
        try {
            reader = XmlExtractor.newFactory().createXMLStreamReader(new ByteArrayInputStream(xml));
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                String name = reader.getLocalName();
                switch (name) {
                    case "title":
                        metadata.title(reader.getElementText().trim());
                        break;
                    case "subject":
                        metadata.subject(reader.getElementText().trim());
                        break;
                    case "creator":
                        String creator = reader.getElementText().trim();
                        metadata.createdBy(creator);
                        metadata.authors(creator.isEmpty() ? null : List.of(creator));
                        break;
                    case "keywords":
                        metadata.keywords(splitKeywords(reader.getElementText()));
                        break;
                    case "lastModifiedBy":
                        metadata.modifiedBy(reader.getElementText().trim());
                        break;
                    case "created":
                        metadata.createdAt(reader.getElementText().trim());
                        break;
                    case "modified":
                        metadata.modifiedAt(reader.getElementText().trim());
                        break;
                    default:
                        break;
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Malformed core properties: " + e.getMessage(), e);
        } finally {
            XmlExtractor.close(reader);
        }
        return metadata;
    }

    static List<String> splitKeywords(String value) {
        List<String> keywords = new ArrayList<>();
        if (value == null) {
            return keywords;
        }
        for (String keyword : value.split("[,;]")) {
            if (!keyword.isBlank()) {
                keywords.add(keyword.trim());
            }
        }
        return keywords;
    }
}
