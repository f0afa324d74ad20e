package dev.quarry.extraction;

import dev.quarry.ExtractedImage;
import dev.quarry.Metadata;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import javax.imageio.ImageIO;
import org.apache.poi.hpsf.SummaryInformation;
import org.apache.poi.ooxml.POIXMLProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metadata and image helpers shared by the POI-backed extractors.
 */
final class PoiSupport {
    private static final Logger LOG = LoggerFactory.getLogger(PoiSupport.class);

    private PoiSupport() {
    }

    static Metadata.Builder metadata(POIXMLProperties properties) {
        Metadata.Builder metadata = Metadata.builder();
        if (properties == null) {
            return metadata;
        }
        POIXMLProperties.CoreProperties core = properties.getCoreProperties();
        if (core != null) {
            metadata.title(core.getTitle())
                .subject(core.getSubject())
                .createdBy(core.getCreator())
                .modifiedBy(core.getLastModifiedByUser())
                .createdAt(iso(core.getCreated()))
                .modifiedAt(iso(core.getModified()))
                .keywords(CoreProperties.splitKeywords(core.getKeywords()));
            String creator = core.getCreator();
            if (creator != null && !creator.isBlank()) {
                metadata.authors(List.of(creator.trim()));
            }
        }
        POIXMLProperties.ExtendedProperties extended = properties.getExtendedProperties();
        if (extended != null && extended.getApplication() != null) {
            metadata.additional("application", extended.getApplication());
        }
        return metadata;
    }

    /**
     * Metadata from the OLE2 summary stream of a legacy Office file.
     */
    static Metadata.Builder metadata(SummaryInformation summary) {
        Metadata.Builder metadata = Metadata.builder();
        if (summary == null) {
            return metadata;
        }
        metadata.title(summary.getTitle())
            .subject(summary.getSubject())
            .createdBy(summary.getAuthor())
            .modifiedBy(summary.getLastAuthor())
            .createdAt(iso(summary.getCreateDateTime()))
            .modifiedAt(iso(summary.getLastSaveDateTime()))
            .keywords(CoreProperties.splitKeywords(summary.getKeywords()));
        String author = summary.getAuthor();
        if (author != null && !author.isBlank()) {
            metadata.authors(List.of(author.trim()));
        }
        if (summary.getApplicationName() != null) {
            metadata.additional("application", summary.getApplicationName());
        }
        return metadata;
    }

    static ExtractedImage image(byte[] data, String extension, int index, Integer pageNumber) {
        Integer width = null;
        Integer height = null;
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(data));
            if (decoded != null) {
                width = decoded.getWidth();
                height = decoded.getHeight();
            }
        } catch (IOException e) {
            LOG.debug("Could not read dimensions of embedded image {}: {}", index, e.getMessage());
        }
        String format = extension != null && !extension.isBlank() ? extension.toLowerCase(Locale.ROOT) : "bin";
        return new ExtractedImage(data, format, index, pageNumber, width, height, null);
    }

    private static String iso(Date date) {
        return date != null ? date.toInstant().toString() : null;
    }
}
