package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import java.io.ByteArrayInputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Generic XML (and SVG) via StAX.
 *
 * <p>Text nodes are emitted as {@code element: text} lines and non-empty attributes as
 * {@code element[attr]: value}. DTDs and external entities are never resolved.</p>
 */
public final class XmlExtractor implements DocumentExtractor {
    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        StringBuilder out = new StringBuilder();
        Set<String> uniqueElements = new TreeSet<>();
        int elementCount = 0;
        String title = null;
        Deque<String> stack = new ArrayDeque<>();
        boolean afterTag = false;

        XMLStreamReader reader = null;
        try {
            reader = newFactory().createXMLStreamReader(new ByteArrayInputStream(data));
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT:
                        String name = reader.getLocalName();
                        elementCount++;
                        uniqueElements.add(name);
                        for (int i = 0; i < reader.getAttributeCount(); i++) {
                            String value = reader.getAttributeValue(i).trim();
                            if (!value.isEmpty()) {
                                newLine(out);
                                out.append(name).append('[').append(reader.getAttributeLocalName(i))
                                    .append("]: ").append(value).append('\n');
                            }
                        }
                        stack.push(name);
                        afterTag = true;
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        stack.poll();
                        afterTag = true;
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                        String text = event == XMLStreamConstants.CDATA ? reader.getText() : reader.getText().trim();
                        if (!text.isEmpty()) {
                            if (afterTag && !stack.isEmpty()) {
                                newLine(out);
                                out.append(stack.peek()).append(": ");
                                if (title == null && "title".equalsIgnoreCase(stack.peek())) {
                                    title = text.trim();
                                }
                            }
                            out.append(text).append('\n');
                            afterTag = false;
                        }
                        break;
                    default:
                        break;
                }
            }
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("XML parsing error: " + e.getMessage(), e);
        } finally {
            close(reader);
        }

        List<String> elements = new ArrayList<>(uniqueElements);
        return ExtractionResult.builder(mimeType)
            .content(out.toString().strip())
            .metadata(Metadata.builder()
                .title(title)
                .additional("element_count", elementCount)
                .additional("unique_elements", elements)
                .build())
            .build();
    }

    static XMLInputFactory newFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    static void close(XMLStreamReader reader) throws QuarryException {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            throw new QuarryException.Parsing("Failed to close XML reader: " + e.getMessage(), e);
        }
    }

    private static void newLine(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
    }
}
