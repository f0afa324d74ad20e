package dev.quarry.extraction;

import dev.quarry.DocumentExtractor;
import dev.quarry.ExtractionResult;
import dev.quarry.Metadata;
import dev.quarry.QuarryException;
import dev.quarry.config.ExtractionConfig;
import dev.quarry.mime.MimeTypes;
import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.hsmf.MAPIMessage;
import org.apache.poi.hsmf.datatypes.AttachmentChunks;
import org.apache.poi.hsmf.datatypes.StringChunk;
import org.apache.poi.hsmf.exceptions.ChunkNotFoundException;
import org.apache.poi.util.RecordFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * E-mail messages: RFC 822 files through Jakarta Mail, Outlook {@code .msg} files through POI HSMF.
 *
 * <p>The content starts with the headers a reader sees (subject, sender, recipients, date), then the
 * body. A plain-text body is preferred; an HTML-only body is reduced to text. Attachments are listed
 * by name only.</p>
 */
public final class EmailExtractor implements DocumentExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(EmailExtractor.class);

    private static final Session SESSION = Session.getInstance(new Properties());

    @Override
    public ExtractionResult extract(byte[] data, String mimeType, ExtractionConfig config) throws QuarryException {
        Mail mail = MimeTypes.MSG.equals(mimeType) ? readOutlook(data) : readRfc822(data);
        return mail.toResult(mimeType);
    }

    static Mail readRfc822(byte[] data) throws QuarryException {
        try {
            MimeMessage message = new MimeMessage(SESSION, new ByteArrayInputStream(data));
            Mail mail = new Mail();
            mail.subject = message.getSubject();
            mail.from = addresses(message.getFrom());
            mail.to = addresses(message.getRecipients(Message.RecipientType.TO));
            mail.cc = addresses(message.getRecipients(Message.RecipientType.CC));
            mail.date = message.getSentDate();
            mail.messageId = message.getMessageID();
            walk(message, mail);
            return mail;
        } catch (MessagingException | IOException e) {
            throw new QuarryException.Parsing("Failed to parse e-mail: " + e.getMessage(), e);
        }
    }

    private static void walk(Part part, Mail mail) throws MessagingException, IOException {
        String fileName = part.getFileName();
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition()) || fileName != null) {
            mail.attachments.add(fileName != null ? decode(fileName) : "unnamed");
            return;
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart child = multipart.getBodyPart(i);
                walk(child, mail);
            }
        } else if (part.isMimeType("message/rfc822")) {
            walk((Part) part.getContent(), mail);
        } else if (part.isMimeType("text/plain")) {
            mail.plain.append(part.getContent()).append('\n');
        } else if (part.isMimeType("text/html")) {
            mail.html.append(part.getContent()).append('\n');
        } else {
            LOG.debug("Skipping e-mail part of type {}", part.getContentType());
        }
    }

    private static String decode(String text) {
        try {
            return MimeUtility.decodeText(text);
        } catch (UnsupportedEncodingException e) {
            LOG.debug("Keeping undecodable header value '{}': {}", text, e.getMessage());
            return text;
        }
    }

    private static List<String> addresses(Address[] addresses) {
        List<String> values = new ArrayList<>();
        if (addresses == null) {
            return values;
        }
        for (Address address : addresses) {
            values.add(address instanceof InternetAddress
                ? ((InternetAddress) address).toUnicodeString() : address.toString());
        }
        return values;
    }

    static Mail readOutlook(byte[] data) throws QuarryException {
        try (MAPIMessage message = new MAPIMessage(new ByteArrayInputStream(data))) {
            message.setReturnNullOnMissingChunk(true);
            Mail mail = new Mail();
            mail.subject = message.getSubject();
            mail.from = splitDisplay(message.getDisplayFrom());
            mail.to = splitDisplay(message.getDisplayTo());
            mail.cc = splitDisplay(message.getDisplayCC());
            Calendar date = message.getMessageDate();
            mail.date = date != null ? date.getTime() : null;
            String text = message.getTextBody();
            if (text != null) {
                mail.plain.append(text);
            } else {
                String html = message.getHtmlBody();
                if (html != null) {
                    mail.html.append(html);
                }
            }
            for (AttachmentChunks attachment : message.getAttachmentFiles()) {
                StringChunk name = attachment.getAttachLongFileName() != null
                    ? attachment.getAttachLongFileName() : attachment.getAttachFileName();
                mail.attachments.add(name != null ? name.getValue() : "unnamed");
            }
            return mail;
        } catch (IOException | ChunkNotFoundException | UnsupportedFileFormatException | RecordFormatException e) {
            throw new QuarryException.Parsing("Failed to parse Outlook message: " + e.getMessage(), e);
        }
    }

    private static List<String> splitDisplay(String display) {
        List<String> values = new ArrayList<>();
        if (display == null || display.isBlank()) {
            return values;
        }
        Arrays.stream(display.split(";"))
            .map(String::strip)
            .filter(value -> !value.isEmpty())
            .forEach(values::add);
        return values;
    }

    /** Fields shared by both message formats. */
    static final class Mail {
        String subject;
        List<String> from = new ArrayList<>();
        List<String> to = new ArrayList<>();
        List<String> cc = new ArrayList<>();
        Date date;
        String messageId;
        final StringBuilder plain = new StringBuilder();
        final StringBuilder html = new StringBuilder();
        final List<String> attachments = new ArrayList<>();

        String body() {
            if (!plain.toString().isBlank()) {
                return Texts.normalizeNewlines(plain.toString()).strip();
            }
            if (!html.toString().isBlank()) {
                return HtmlExtractor.text(html.toString());
            }
            return "";
        }

        ExtractionResult toResult(String mimeType) {
            StringBuilder content = new StringBuilder();
            header(content, "Subject", subject);
            header(content, "From", String.join(", ", from));
            header(content, "To", String.join(", ", to));
            header(content, "Cc", String.join(", ", cc));
            header(content, "Date", date != null ? date.toInstant().toString() : null);
            String body = body();
            if (!body.isEmpty()) {
                content.append('\n').append(body).append('\n');
            }
            if (!attachments.isEmpty()) {
                content.append("\nAttachments: ").append(String.join(", ", attachments)).append('\n');
            }

            Metadata.Builder metadata = Metadata.builder()
                .title(subject)
                .createdAt(date != null ? date.toInstant().toString() : null)
                .additional("email_from", from)
                .additional("email_to", to)
                .additional("attachment_count", attachments.size());
            if (!from.isEmpty()) {
                metadata.authors(from);
            }
            if (!cc.isEmpty()) {
                metadata.additional("email_cc", cc);
            }
            if (messageId != null) {
                metadata.additional("message_id", messageId);
            }
            if (!attachments.isEmpty()) {
                metadata.additional("attachments", attachments);
            }
            return ExtractionResult.builder(mimeType)
                .content(Texts.tidy(content.toString()))
                .metadata(metadata.build())
                .build();
        }

        private static void header(StringBuilder content, String name, String value) {
            if (value != null && !value.isBlank()) {
                content.append(name).append(": ").append(value.strip()).append('\n');
            }
        }
    }
}
