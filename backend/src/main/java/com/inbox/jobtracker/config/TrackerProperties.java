package com.inbox.jobtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    public static final List<String> DEFAULT_SUBJECT_KEYWORDS = List.of(
        "applied",
        "application",
        "thanks for applying",
        "thanks from",
        "follow-up",
        "update",
        "recruiting",
        "thank you for applying"
    );

    private int lookbackMonths = 4;
    private int requestTimeoutSeconds = 0;
    private Mailbox mailbox = new Mailbox();
    private Filter filter = new Filter();
    private Parser parser = new Parser();
    private Store store = new Store();
    private Report report = new Report();
    private Pipeline pipeline = new Pipeline();
    private Cli cli = new Cli();

    public int getLookbackMonths() {
        return Math.max(1, lookbackMonths);
    }

    public void setLookbackMonths(int lookbackMonths) {
        this.lookbackMonths = Math.max(1, lookbackMonths);
    }

    /**
     * Per-request timeout for the parser and store HTTP calls. Zero or less disables it.
     */
    public int getRequestTimeoutSeconds() {
        return Math.max(0, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(0, requestTimeoutSeconds);
    }

    public Mailbox getMailbox() {
        return mailbox;
    }

    public void setMailbox(Mailbox mailbox) {
        this.mailbox = mailbox;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public Parser getParser() {
        return parser;
    }

    public void setParser(Parser parser) {
        this.parser = parser;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    public static class Mailbox {
        private String host = "imap.gmail.com";
        private int port = 993;
        private boolean ssl = true;
        private String username = "";
        private String password = "";
        private String folder = "INBOX";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = trimToEmpty(host);
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public boolean isSsl() {
            return ssl;
        }

        public void setSsl(boolean ssl) {
            this.ssl = ssl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = trimToEmpty(username);
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password == null ? "" : password;
        }

        public String getFolder() {
            return folder.isBlank() ? "INBOX" : folder;
        }

        public void setFolder(String folder) {
            this.folder = trimToEmpty(folder);
        }
    }

    public static class Filter {
        private List<String> keywords = new ArrayList<>(DEFAULT_SUBJECT_KEYWORDS);

        /**
         * Lower-cased, non-blank keywords. An empty configuration falls back to the defaults.
         */
        public List<String> getKeywords() {
            List<String> normalized = new ArrayList<>();
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
            return normalized.isEmpty() ? DEFAULT_SUBJECT_KEYWORDS : List.copyOf(normalized);
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : new ArrayList<>(keywords);
        }
    }

    public static class Parser {
        private String endpoint = "https://api.openai.com/v1/chat/completions";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private String defaultStatus = "Applied";

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = trimToEmpty(endpoint);
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = trimToEmpty(apiKey);
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = trimToEmpty(model);
        }

        public String getDefaultStatus() {
            return defaultStatus.isBlank() ? "Applied" : defaultStatus;
        }

        public void setDefaultStatus(String defaultStatus) {
            this.defaultStatus = trimToEmpty(defaultStatus);
        }
    }

    public static class Store {
        private String baseUrl = "https://api.notion.com/v1";
        private String token = "";
        private String databaseId = "";
        private String notionVersion = "2022-06-28";

        public String getBaseUrl() {
            return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = trimToEmpty(baseUrl);
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = trimToEmpty(token);
        }

        public String getDatabaseId() {
            return databaseId;
        }

        public void setDatabaseId(String databaseId) {
            this.databaseId = trimToEmpty(databaseId);
        }

        public String getNotionVersion() {
            return notionVersion;
        }

        public void setNotionVersion(String notionVersion) {
            this.notionVersion = trimToEmpty(notionVersion);
        }
    }

    public static class Report {
        private String outputDir = "unparsed";
        private String fileName = "unparsed_emails.csv";
        private String zoneId = "";

        public String getOutputDir() {
            return outputDir.isBlank() ? "unparsed" : outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = trimToEmpty(outputDir);
        }

        public String getFileName() {
            return fileName.isBlank() ? "unparsed_emails.csv" : fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = trimToEmpty(fileName);
        }

        /**
         * Zone used to render failure timestamps. Blank or unknown ids mean the system default.
         */
        public ZoneId getZone() {
            if (zoneId.isBlank()) {
                return ZoneId.systemDefault();
            }
            try {
                return ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                return ZoneId.systemDefault();
            }
        }

        public String getZoneId() {
            return zoneId;
        }

        public void setZoneId(String zoneId) {
            this.zoneId = trimToEmpty(zoneId);
        }
    }

    public static class Pipeline {
        private int channelCapacity = 1;

        public int getChannelCapacity() {
            return Math.max(1, channelCapacity);
        }

        public void setChannelCapacity(int channelCapacity) {
            this.channelCapacity = Math.max(1, channelCapacity);
        }
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
