package com.inbox.jobtracker.ingest.extract;

import com.inbox.jobtracker.ingest.model.MailAddress;
import com.inbox.jobtracker.ingest.model.RawMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SenderExtractor {
    private static final Logger log = LoggerFactory.getLogger(SenderExtractor.class);

    public String extractSender(RawMessage raw) {
        if (raw == null || raw.envelope() == null || raw.envelope().from().isEmpty()) {
            log.debug("No sender info in email");
            return "";
        }
        MailAddress from = raw.envelope().from().get(0);
        String email = from.asEmail();
        log.debug("Sender email: {}", email);
        return email;
    }
}
