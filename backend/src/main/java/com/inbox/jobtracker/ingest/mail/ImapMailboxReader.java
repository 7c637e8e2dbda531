package com.inbox.jobtracker.ingest.mail;

import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.model.BodyPart;
import com.inbox.jobtracker.ingest.model.MailAddress;
import com.inbox.jobtracker.ingest.model.MessageEnvelope;
import com.inbox.jobtracker.ingest.model.RawMessage;
import com.inbox.jobtracker.ingest.service.TrackerSetupException;
import jakarta.mail.Address;
import jakarta.mail.FetchProfile;
import jakarta.mail.Folder;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.StoreClosedException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Properties;

/**
 * Reads the configured IMAP folder with Jakarta Mail. The folder is opened read-only so a run
 * never changes message flags.
 */
@Service
public class ImapMailboxReader implements MailboxReader {
    private static final Logger log = LoggerFactory.getLogger(ImapMailboxReader.class);

    private final TrackerProperties properties;

    public ImapMailboxReader(TrackerProperties properties) {
        this.properties = properties;
    }

    @Override
    public MessageBatch fetch(Instant since) {
        TrackerProperties.Mailbox mailbox = properties.getMailbox();
        if (mailbox.getUsername().isBlank() || mailbox.getPassword().isBlank()) {
            throw new TrackerSetupException("Mailbox credentials are not configured (tracker.mailbox.username/password)");
        }

        String protocol = mailbox.isSsl() ? "imaps" : "imap";
        Properties props = new Properties();
        props.put("mail.store.protocol", protocol);
        props.put("mail." + protocol + ".host", mailbox.getHost());
        props.put("mail." + protocol + ".port", String.valueOf(mailbox.getPort()));
        props.put("mail." + protocol + ".ssl.enable", String.valueOf(mailbox.isSsl()));

        Store store = null;
        try {
            Session session = Session.getInstance(props);
            store = session.getStore(protocol);
            store.connect(mailbox.getHost(), mailbox.getPort(), mailbox.getUsername(), mailbox.getPassword());
            log.debug("Connected to IMAP: host={}, port={}, ssl={}", mailbox.getHost(), mailbox.getPort(), mailbox.isSsl());

            Folder folder = store.getFolder(mailbox.getFolder());
            folder.open(Folder.READ_ONLY);
            Message[] messages = folder.search(new ReceivedDateTerm(ComparisonTerm.GE, Date.from(since)));

            FetchProfile profile = new FetchProfile();
            profile.add(FetchProfile.Item.ENVELOPE);
            profile.add(FetchProfile.Item.CONTENT_INFO);
            folder.fetch(messages, profile);

            log.debug("Search in {} since {} matched {} messages", mailbox.getFolder(), since, messages.length);
            return new ImapMessageBatch(store, folder, messages);
        } catch (MessagingException e) {
            closeQuietly(store);
            throw new TrackerSetupException(
                "Mailbox setup failed for " + mailbox.getHost() + "/" + mailbox.getFolder() + ": " + e.getMessage(),
                e
            );
        }
    }

    static RawMessage toRawMessage(Message message) {
        MessageEnvelope envelope = readEnvelope(message);
        List<BodyPart> parts = new ArrayList<>();
        try {
            collectParts(message, parts);
        } catch (FolderClosedException | StoreClosedException e) {
            throw new MailboxReadException("Mailbox connection lost while reading message " + message.getMessageNumber(), e);
        } catch (MessagingException | IOException e) {
            log.warn("Could not read body of message {}: {}", message.getMessageNumber(), e.getMessage());
        }
        return new RawMessage(envelope, parts);
    }

    private static MessageEnvelope readEnvelope(Message message) {
        try {
            Date date = message.getSentDate();
            if (date == null) {
                date = message.getReceivedDate();
            }
            return new MessageEnvelope(
                message.getSubject(),
                readFrom(message),
                date == null ? null : date.toInstant()
            );
        } catch (FolderClosedException | StoreClosedException e) {
            throw new MailboxReadException("Mailbox connection lost while reading message " + message.getMessageNumber(), e);
        } catch (MessagingException e) {
            log.warn("No envelope for message {}: {}", message.getMessageNumber(), e.getMessage());
            return null;
        }
    }

    private static List<MailAddress> readFrom(Message message) throws MessagingException {
        try {
            return fromAddresses(message.getFrom());
        } catch (FolderClosedException | StoreClosedException e) {
            throw e;
        } catch (MessagingException e) {
            log.warn("Unreadable From header on message {}: {}", message.getMessageNumber(), e.getMessage());
            return List.of();
        }
    }

    private static List<MailAddress> fromAddresses(Address[] addresses) {
        if (addresses == null) {
            return List.of();
        }
        List<MailAddress> result = new ArrayList<>();
        for (Address address : addresses) {
            if (!(address instanceof InternetAddress internetAddress) || internetAddress.getAddress() == null) {
                continue;
            }
            String email = internetAddress.getAddress();
            int at = email.lastIndexOf('@');
            if (at < 0) {
                result.add(new MailAddress(email, ""));
            } else {
                result.add(new MailAddress(email.substring(0, at), email.substring(at + 1)));
            }
        }
        return result;
    }

    private static void collectParts(Part part, List<BodyPart> out) throws MessagingException, IOException {
        if (part.isMimeType("multipart/*")) {
            Object content = part.getContent();
            if (content instanceof Multipart multipart) {
                for (int i = 0; i < multipart.getCount(); i++) {
                    collectParts(multipart.getBodyPart(i), out);
                }
                return;
            }
        }
        try (InputStream in = part.getInputStream()) {
            out.add(new BodyPart(part.getContentType(), in.readAllBytes()));
        }
    }

    private static void closeQuietly(Store store) {
        if (store == null) {
            return;
        }
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Ignoring error while closing IMAP store: {}", e.getMessage());
        }
    }

    private static final class ImapMessageBatch implements MessageBatch {
        private final Store store;
        private final Folder folder;
        private final Message[] messages;

        private ImapMessageBatch(Store store, Folder folder, Message[] messages) {
            this.store = store;
            this.folder = folder;
            this.messages = messages;
        }

        @Override
        public int size() {
            return messages.length;
        }

        @Override
        public Iterator<RawMessage> iterator() {
            return new Iterator<>() {
                private int index;

                @Override
                public boolean hasNext() {
                    return index < messages.length;
                }

                @Override
                public RawMessage next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return toRawMessage(messages[index++]);
                }
            };
        }

        @Override
        public void close() {
            try {
                if (folder.isOpen()) {
                    folder.close(false);
                }
            } catch (MessagingException e) {
                log.debug("Ignoring error while closing IMAP folder: {}", e.getMessage());
            }
            closeQuietly(store);
        }
    }
}
