package com.harbour.jobfeed.feed.jobs;

import com.harbour.jobfeed.feed.http.PoliteHttpClient;
import com.harbour.jobfeed.feed.model.HttpFetchResult;
import com.harbour.jobfeed.feed.model.ScrapeResult;
import com.harbour.jobfeed.feed.model.ScrapedJob;
import com.harbour.jobfeed.feed.util.JobDates;
import com.harbour.jobfeed.feed.util.JobUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts job fields from posting pages that present them as labelled table rows or
 * "Label: value" paragraphs.
 */
@Component
public class LabelledJobPageScraper implements JobPageScraper {
    private static final Logger log = LoggerFactory.getLogger(LabelledJobPageScraper.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String NA = ScrapedJob.NOT_AVAILABLE;
    private static final String WHATSAPP_FOOTER = "Join our WhatsApp";
    private static final int MAX_HEADING_LENGTH = 80;
    // Post bodies on these sites carry no reliable posting date; records are dated on scrape.
    private static final Set<String> SCRAPE_DATED_DOMAINS = Set.of("fresheropenings.com");

    private static final String COMPANY = "company";
    private static final String JOB_TITLE = "jobTitle";
    private static final String EXPERIENCE = "experience";
    private static final String LOCATION = "location";

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s:\\-\\u2013]+$");
    private static final Pattern LABEL_VALUE = Pattern.compile("^([^:]+):\\s*(.+)$");
    private static final Pattern HEADING_COMPANY = Pattern.compile(
        "^(.+?)\\s+(Walk-?in|Off\\s*Campus|Off-Campus|Recruitment|Hiring|Jobs|Careers)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern HEADING_ROLE = Pattern.compile(
        "\\bas\\s+([^|:]+?)(\\s+with|\\s*\\||$)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Set<String> DESCRIPTION_HEADINGS = Set.of(
        "key responsibilities", "job description", "job summary", "opportunity details", "details about role",
        "work details", "work summary", "description", "about the job", "about job", "about the role",
        "role description", "position description", "job overview", "role overview", "what you will do",
        "responsibilities", "duties", "job responsibilities", "position overview"
    );
    private static final Pattern DESCRIPTION_HEADING_PATTERN = Pattern.compile(
        "\\b(job(s)?\\s+description(s)?|job(s)?\\s+summary|key\\s+responsibilit(y|ies)|responsibilit(y|ies)"
            + "|key\\s+duties|duties\\s+and\\s+responsibilit(y|ies)|position\\s+(description|overview|profile)"
            + "|about\\s+(the\\s+)?(job|role)|job\\s+role|about\\s+position|what\\s+you('ll|\\s+will)?\\s+do"
            + "|your\\s+role|opportunity\\s+details|details\\s+about\\s+(the\\s+)?role|role\\s+overview"
            + "|work\\s+(details|summary)|job\\s+profile|job\\s+purpose|role\\s+description"
            + "|job\\s+information|role\\s+and\\s+responsibilit(y|ies)|job\\s+functions)"
    );

    private static final Map<String, String> TABLE_LABELS = buildTableLabels();
    private static final Map<String, String> PARAGRAPH_LABELS = Map.of(
        "job", JOB_TITLE,
        "job role", JOB_TITLE,
        "position", JOB_TITLE,
        "role", JOB_TITLE,
        "experience", EXPERIENCE,
        "job location", LOCATION,
        "location", LOCATION
    );

    private final PoliteHttpClient httpClient;
    private final Clock clock;

    public LabelledJobPageScraper(PoliteHttpClient httpClient, Clock clock) {
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public ScrapeResult scrape(String url) {
        HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT);
        if (fetch == null || !fetch.isSuccessful() || fetch.body() == null) {
            log.warn(
                "Failed to fetch job page {} (status={}, error={})",
                url,
                fetch == null ? null : fetch.statusCode(),
                fetch == null ? null : fetch.errorCode()
            );
            return ScrapeResult.failed("fetch_failed");
        }
        try {
            ScrapedJob job = extract(fetch.body(), url);
            log.debug("Scraped {} -> {}", url, job);
            return ScrapeResult.success(job);
        } catch (Exception e) {
            log.warn("Failed to parse job page {}", url, e);
            return ScrapeResult.failed("parse_failed");
        }
    }

    public ScrapedJob extract(String html, String sourceUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, sourceUrl == null ? "" : sourceUrl);
        Map<String, String> fields = new HashMap<>();

        readTableRows(document, fields);
        readLabelledParagraphs(document, fields);
        readHeading(document, fields);

        LocalDate posted = null;
        if (!JobUrlUtils.matchesAllowedDomain(sourceUrl, SCRAPE_DATED_DOMAINS)) {
            posted = JobDates.findLongDate(document.text());
        }
        if (posted == null) {
            posted = LocalDate.now(clock);
        }

        return new ScrapedJob(
            sourceUrl,
            posted.toString(),
            orNa(fields.get(COMPANY)),
            orNa(fields.get(JOB_TITLE)),
            orNa(fields.get(EXPERIENCE)),
            orNa(fields.get(LOCATION)),
            orNa(extractApplyLink(document)),
            orNa(extractDescription(document))
        );
    }

    private void readTableRows(Document document, Map<String, String> fields) {
        Element table = document.selectFirst("table");
        if (table == null) {
            return;
        }
        for (Element row : table.select("tr")) {
            List<Element> cells = row.select("th, td");
            if (cells.size() < 2) {
                continue;
            }
            String field = TABLE_LABELS.get(normalizeLabel(cells.get(0).text()));
            String value = cells.get(1).text().trim();
            if (field != null && !value.isEmpty()) {
                fields.put(field, value);
            }
        }
    }

    private void readLabelledParagraphs(Document document, Map<String, String> fields) {
        for (Element paragraph : document.select("p")) {
            String text = paragraph.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            String label;
            String value;
            Matcher matcher = LABEL_VALUE.matcher(text);
            if (matcher.matches()) {
                label = matcher.group(1);
                value = matcher.group(2);
            } else {
                String[] parts = text.split("\\s+", 2);
                if (parts.length != 2) {
                    continue;
                }
                label = parts[0];
                value = parts[1];
            }
            String field = PARAGRAPH_LABELS.get(normalizeLabel(label));
            if (field != null && !value.isBlank()) {
                fields.putIfAbsent(field, value.trim());
            }
        }
    }

    private void readHeading(Document document, Map<String, String> fields) {
        Element heading = document.selectFirst("h1, h2");
        if (heading == null) {
            return;
        }
        String text = heading.text().trim();
        Matcher company = HEADING_COMPANY.matcher(text);
        if (company.find()) {
            fields.putIfAbsent(COMPANY, company.group(1).trim());
        }
        Matcher role = HEADING_ROLE.matcher(text);
        if (role.find()) {
            fields.putIfAbsent(JOB_TITLE, role.group(1).trim());
        }
    }

    private String extractDescription(Document document) {
        List<String> parts = new ArrayList<>();
        Element aboutLabel = firstLabel(document, "about company");
        if (aboutLabel != null) {
            Element aboutParagraph = firstAfter(document, aboutLabel, "p");
            if (aboutParagraph != null && !aboutParagraph.text().isBlank()) {
                parts.add(aboutParagraph.text().trim());
            }
        }

        Element section = null;
        for (Element paragraph : document.select("p")) {
            if (isDescriptionHeading(paragraph.text())) {
                section = paragraph;
                break;
            }
        }
        if (section != null) {
            for (Element sibling : section.nextElementSiblings()) {
                if ("p".equals(sibling.normalName())) {
                    parts.add(sibling.text().trim());
                } else if ("ul".equals(sibling.normalName())) {
                    for (Element item : sibling.select("li")) {
                        parts.add(item.text().trim());
                    }
                }
            }
        }

        if (parts.isEmpty()) {
            return null;
        }
        String joined = String.join("\n\n", parts);
        int footer = joined.indexOf(WHATSAPP_FOOTER);
        return footer >= 0 ? joined.substring(0, footer).trim() : joined;
    }

    private String extractApplyLink(Document document) {
        Element applyLabel = firstLabel(document, "apply link");
        if (applyLabel != null) {
            Element anchor = firstAfter(document, applyLabel, "a");
            if (anchor != null && anchor.hasAttr("href")) {
                return anchor.attr("href");
            }
        }
        for (Element anchor : document.select("a[href]")) {
            if (anchor.text().toLowerCase(Locale.ROOT).contains("click here")) {
                return anchor.attr("href");
            }
        }
        return null;
    }

    private boolean isDescriptionHeading(String text) {
        if (text == null) {
            return false;
        }
        String normalized = normalizeLabel(text);
        if (normalized.isEmpty() || normalized.length() > MAX_HEADING_LENGTH) {
            return false;
        }
        return DESCRIPTION_HEADINGS.contains(normalized) || DESCRIPTION_HEADING_PATTERN.matcher(normalized).find();
    }

    private Element firstLabel(Document document, String needle) {
        for (Element label : document.select("strong, b")) {
            if (label.text().toLowerCase(Locale.ROOT).contains(needle)) {
                return label;
            }
        }
        return null;
    }

    // Next element with the given tag in document order.
    private Element firstAfter(Document document, Element anchor, String tagName) {
        boolean passed = false;
        for (Element element : document.getAllElements()) {
            if (element == anchor) {
                passed = true;
                continue;
            }
            if (passed && tagName.equals(element.normalName())) {
                return element;
            }
        }
        return null;
    }

    static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        return TRAILING_PUNCTUATION.matcher(label.trim()).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private String orNa(String value) {
        return value == null || value.isBlank() ? NA : value.trim();
    }

    private static Map<String, String> buildTableLabels() {
        Map<String, String> labels = new HashMap<>();
        for (String label : List.of(
            "company name", "recruitment authority", "employer name", "company/organization", "company info",
            "institution", "institution -company", "company", "hiring company", "organisation", "organization",
            "employer", "firm", "recruiter", "hiring organization"
        )) {
            labels.put(label, COMPANY);
        }
        for (String label : List.of(
            "job role", "opening title", "vacancy", "vacancy title", "position name", "job opening", "hiring for",
            "job name", "role", "position", "job title", "title", "designation", "post", "opening",
            "position title", "job position"
        )) {
            labels.put(label, JOB_TITLE);
        }
        for (String label : List.of(
            "experience", "experience needed", "years required", "required work experience", "experienced",
            "experiences", "work experience", "required experience", "minimum experience", "experience required",
            "exp", "exp.", "total experience", "years of experience", "experience level", "prior experience",
            "professional experience"
        )) {
            labels.put(label, EXPERIENCE);
        }
        for (String label : List.of(
            "job location", "job posting location", "office", "job place", "location", "locations",
            "work location", "posting location", "place of posting", "place", "job locations", "workplace",
            "office location", "duty location"
        )) {
            labels.put(label, LOCATION);
        }
        return Map.copyOf(labels);
    }
}
