package com.inbox.jobtracker.ingest.extract;

import com.inbox.jobtracker.ingest.model.BodyPart;
import com.inbox.jobtracker.ingest.model.RawMessage;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a message to one plain-text body. The first text/plain part wins outright;
 * otherwise the last text/html part seen is stripped of tags. Parts with a missing or
 * malformed Content-Type are skipped.
 */
@Component
public class BodyExtractor {
    private static final Logger log = LoggerFactory.getLogger(BodyExtractor.class);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");

    public String extractBody(RawMessage raw) {
        if (raw == null || raw.bodyParts().isEmpty()) {
            log.debug("No message body found");
            return "";
        }

        String htmlBody = null;
        for (BodyPart part : raw.bodyParts()) {
            String header = part.contentType();
            if (header == null || header.isBlank()) {
                log.debug("Missing Content-Type header in email part");
                continue;
            }
            ContentType contentType;
            try {
                contentType = new ContentType(header);
            } catch (ParseException e) {
                log.debug("Failed to parse media type '{}': {}", header, e.getMessage());
                continue;
            }

            String mediaType = contentType.getBaseType().toLowerCase(Locale.ROOT);
            if (mediaType.startsWith("text/plain")) {
                String body = decode(part, contentType);
                log.debug("Extracted plain text body (length: {})", body.length());
                return body;
            }
            if (mediaType.startsWith("text/html")) {
                htmlBody = decode(part, contentType);
            }
        }

        if (htmlBody != null && !htmlBody.isEmpty()) {
            log.debug("No text/plain found, using HTML fallback");
            return stripHtmlTags(htmlBody);
        }
        log.debug("No text/plain or usable html body found");
        return "";
    }

    static String stripHtmlTags(String html) {
        String text = HTML_TAG.matcher(html).replaceAll("");
        return text.replace("&nbsp;", " ").strip();
    }

    private String decode(BodyPart part, ContentType contentType) {
        return new String(part.content(), charsetOf(contentType));
    }

    private Charset charsetOf(ContentType contentType) {
        String declared = contentType.getParameter("charset");
        if (declared == null || declared.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(MimeUtility.javaCharset(declared.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("Unsupported charset '{}', decoding as UTF-8", declared);
            return StandardCharsets.UTF_8;
        }
    }
}
