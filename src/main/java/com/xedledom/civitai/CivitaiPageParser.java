package com.xedledom.civitai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.xedledom.civitai.model.PageMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes model fields straight from a model page when the API cannot be used.
 *
 * <p>Each field has an ordered list of rules over the parsed page; the first rule that
 * yields a non-blank value wins. Embedded page-state JSON ({@code __NEXT_DATA__}) comes
 * first, markup heuristics after it. Rules are pure functions of the page.
 */
public class CivitaiPageParser {

    private static final Logger log = LoggerFactory.getLogger(CivitaiPageParser.class);

    private static final Pattern BASE_MODEL_LABEL = Pattern.compile("\\bBase\\s*Model\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern VERSION_IN_TITLE = Pattern.compile("\\bv[\\d.]+|v\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ABOUT_VERSION = Pattern.compile("About\\s+this\\s+version", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACTIVE_BUTTON = Pattern.compile("mantine-(active|Button-root)");
    private static final Pattern SPOILER_CONTENT = Pattern.compile("mantine-Spoiler-content");
    private static final Pattern ANY_SPOILER_CONTENT = Pattern.compile("Spoiler-content");
    private static final Pattern HTML_RENDERER = Pattern.compile("RenderHtml_htmlRenderer");
    private static final Pattern ACCORDION_PANEL = Pattern.compile("Accordion-panel");
    private static final Pattern BADGE = Pattern.compile("Badge-root");
    private static final Pattern MEDIA_CONTAINER = Pattern.compile("EdgeMedia_container|mantine-AspectRatio-root");
    private static final Pattern EDGE_IMAGE = Pattern.compile("EdgeImage_image");
    private static final Pattern EDGE_VIDEO = Pattern.compile("EdgeMedia_responsive");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final int MIN_DESCRIPTION_LENGTH = 50;
    static final int MAX_TRIGGER_WORD_LENGTH = 40;

    private final ObjectMapper mapper;

    public CivitaiPageParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // =========================================================================
    // Rule lists
    // =========================================================================

    static final List<Function<Page, String>> TITLE = List.of(
            p -> textOf(p.doc().selectFirst("h1")),
            p -> attrOf(p.doc().selectFirst("meta[property=og:title]"), "content")
    );

    static final List<Function<Page, String>> TYPE = List.of(
            p -> jsonText(p.modelVersion(), "baseModelType"),
            p -> tableValue(p.doc(), "Type")
    );

    static final List<Function<Page, String>> BASE_MODEL = List.of(
            p -> jsonText(p.modelVersion(), "baseModel"),
            p -> baseModelRow(p.doc())
    );

    static final List<Function<Page, String>> PUBLISHED_ON = List.of(
            p -> datePart(jsonText(p.ldJson(), "datePublished")),
            p -> datePart(tooltipDate(p.doc()))
    );

    static final List<Function<Page, String>> VERSION = List.of(
            p -> jsonText(p.modelVersion(), "name"),
            p -> activeVersionButton(p.doc()),
            p -> versionFromTitle(firstNonBlank(p, TITLE))
    );

    static final List<Function<Page, String>> DESCRIPTION = List.of(
            CivitaiPageParser::jsonDescription,
            p -> spoilerDescription(p.doc()),
            p -> outerHtmlOf(p.doc().selectFirst("div[data-testid=model-description]"))
    );

    static final List<Function<Page, String>> ABOUT_VERSION_NOTES = List.of(
            p -> firstJsonText(p.modelVersion(), "description", "descriptionHtml", "notes", "changelog"),
            p -> aboutVersionPanel(p.doc()),
            p -> outerHtmlOf(firstWithClass(p.doc().getElementsByTag("div"), ACCORDION_PANEL))
    );

    static final List<Function<Page, String>> TRIGGER_WORDS = List.of(
            p -> joinJsonArray(p.modelVersion().path("trainedWords")),
            p -> triggerWordsRow(p.doc()),
            p -> triggerWordsAfterBaseModel(p.doc())
    );

    static final List<Function<Page, String>> SIZE = List.of(
            p -> jsonSize(p.modelVersion()),
            p -> tableValue(p.doc(), "File Size")
    );

    static final List<Function<Page, String>> THUMBNAIL = List.of(
            p -> absolute(p, attrOf(p.doc().selectFirst("meta[property=og:image]"), "content")),
            p -> absolute(p, attrOf(mediaImage(p.doc()), "src")),
            p -> absolute(p, attrOf(mediaVideo(p.doc()), "poster")),
            p -> absolute(p, ldImage(p.ldJson()))
    );

    static final List<Function<Page, String>> VIDEO = List.of(
            p -> absolute(p, bestVideoSource(mediaVideo(p.doc())))
    );

    // =========================================================================
    // Parsing
    // =========================================================================

    public PageMetadata parse(String baseUrl, String html) {
        Page page = page(baseUrl, html);

        String type = normalizeType(firstNonBlank(page, TYPE));
        String baseModel = WHITESPACE.matcher(firstNonBlank(page, BASE_MODEL)).replaceAll(" ").trim();
        String about = firstNonBlank(page, ABOUT_VERSION_NOTES).replaceAll("\\n\\s+", "\n");
        String triggerWords = firstNonBlank(page, TRIGGER_WORDS).replaceAll("\\s*,\\s*", ", ");
        String size = firstNonBlank(page, SIZE).replace("  ", " ").trim();

        return new PageMetadata(
                firstNonBlank(page, TITLE),
                type,
                baseModel,
                firstNonBlank(page, PUBLISHED_ON),
                firstNonBlank(page, VERSION),
                about,
                firstNonBlank(page, DESCRIPTION),
                triggerWords,
                size,
                unescapeAmp(firstNonBlank(page, THUMBNAIL)),
                unescapeAmp(firstNonBlank(page, VIDEO)),
                baseUrl == null ? "" : baseUrl.trim()
        );
    }

    Page page(String baseUrl, String html) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        Document doc = Jsoup.parse(html == null ? "" : html, base);
        JsonNode nextData = readScriptJson(doc.selectFirst("script#__NEXT_DATA__"));
        JsonNode ld = readScriptJson(doc.selectFirst("script[type=application/ld+json]"));
        JsonNode pageProps = nextData.path("props").path("pageProps");
        return new Page(base, doc, pageProps.path("modelVersion"), pageProps.path("model"), ld);
    }

    static String firstNonBlank(Page page, List<Function<Page, String>> rules) {
        for (Function<Page, String> rule : rules) {
            String value = rule.apply(page);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private JsonNode readScriptJson(Element script) {
        if (script == null) {
            return MissingNode.getInstance();
        }
        try {
            JsonNode node = mapper.readTree(script.data());
            return node == null ? MissingNode.getInstance() : node;
        } catch (Exception e) {
            log.debug("Ignoring unparsable embedded JSON: {}", e.getMessage());
            return MissingNode.getInstance();
        }
    }

    /**
     * Parsed page plus the embedded JSON blocks the rules read from.
     */
    record Page(String baseUrl, Document doc, JsonNode modelVersion, JsonNode model, JsonNode ldJson) {}

    // =========================================================================
    // Field rules
    // =========================================================================

    static String normalizeType(String raw) {
        String t = raw == null ? "" : raw.trim();
        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.equals("lora") || lower.equals("loras")) return "lora";
        if (lower.equals("checkpoint") || lower.equals("checkpoints")) return "checkpoint";
        return t;
    }

    static String tableValue(Document doc, String label) {
        for (Element tr : doc.getElementsByTag("tr")) {
            Elements tds = tr.getElementsByTag("td");
            if (tds.size() < 2) continue;
            Element leftP = tds.get(0).selectFirst("p");
            if (leftP != null && leftP.text().equals(label)) {
                Element rightP = tds.get(1).selectFirst("p");
                return rightP != null ? rightP.text() : tds.get(1).text();
            }
        }
        return "";
    }

    static String baseModelRow(Document doc) {
        for (Element tr : doc.getElementsByTag("tr")) {
            Elements tds = tr.getElementsByTag("td");
            if (tds.size() < 2) continue;
            Element leftP = tds.get(0).selectFirst("p");
            if (leftP == null || !BASE_MODEL_LABEL.matcher(leftP.text()).find()) continue;
            Element rightP = tds.get(1).selectFirst("p");
            String value = rightP != null ? rightP.text() : tds.get(1).text();
            if (!value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    static String tooltipDate(Document doc) {
        for (Element abbr : doc.select("abbr[title]")) {
            Matcher m = ISO_DATE.matcher(abbr.attr("title"));
            if (m.find()) {
                return m.group();
            }
        }
        return "";
    }

    static String datePart(String value) {
        if (value == null || value.isBlank()) return "";
        int t = value.indexOf('T');
        return (t >= 0 ? value.substring(0, t) : value).trim();
    }

    static String activeVersionButton(Document doc) {
        for (Element button : doc.select("button[data-variant=filled]")) {
            if (!ACTIVE_BUTTON.matcher(button.className()).find()) continue;
            String text = WHITESPACE.matcher(button.text()).replaceAll(" ").trim();
            if (text.isEmpty()) return "";
            String[] tokens = text.split(" ");
            return tokens.length <= 3 ? tokens[tokens.length - 1] : text;
        }
        return "";
    }

    static String versionFromTitle(String title) {
        if (title == null) return "";
        Matcher m = VERSION_IN_TITLE.matcher(title);
        return m.find() ? m.group() : "";
    }

    static String jsonDescription(Page page) {
        List<String> candidates = new ArrayList<>();
        for (JsonNode source : List.of(page.modelVersion(), page.model(), page.ldJson())) {
            if (source == null || !source.isObject()) continue;
            for (String key : List.of("descriptionHtml", "description", "details")) {
                JsonNode value = source.get(key);
                if (value != null && value.isTextual() && value.asText().trim().length() >= MIN_DESCRIPTION_LENGTH) {
                    candidates.add(value.asText().trim());
                }
            }
        }
        return candidates.stream()
                .filter(d -> d.contains("<") && d.contains(">"))
                .findFirst()
                .orElse(candidates.isEmpty() ? "" : candidates.get(0));
    }

    static String spoilerDescription(Document doc) {
        Element spoiler = firstWithClass(doc.getElementsByTag("div"), SPOILER_CONTENT);
        if (spoiler == null) return "";
        Element inner = firstWithClass(spoiler.getElementsByTag("div"), HTML_RENDERER);
        return inner != null && inner != spoiler ? inner.outerHtml() : spoiler.outerHtml();
    }

    static String aboutVersionPanel(Document doc) {
        for (Element button : doc.getElementsByTag("button")) {
            if (!ABOUT_VERSION.matcher(button.text()).find()) continue;
            for (Element sibling : button.nextElementSiblings()) {
                if (sibling.tagName().equals("div") && ACCORDION_PANEL.matcher(sibling.className()).find()) {
                    Element spoiler = firstWithClass(sibling.getElementsByTag("div"), ANY_SPOILER_CONTENT);
                    return spoiler != null && spoiler != sibling ? spoiler.outerHtml() : sibling.outerHtml();
                }
            }
        }
        return "";
    }

    static String triggerWordsRow(Document doc) {
        for (Element tr : doc.getElementsByTag("tr")) {
            Elements tds = tr.getElementsByTag("td");
            if (tds.size() < 2) continue;
            Element leftP = tds.get(0).selectFirst("p");
            if (leftP != null && leftP.text().equals("Trigger Words")) {
                return collectWords(tds.get(1));
            }
        }
        return "";
    }

    static String triggerWordsAfterBaseModel(Document doc) {
        Elements rows = doc.getElementsByTag("tr");
        for (int i = 0; i < rows.size() - 1; i++) {
            Element firstTd = rows.get(i).selectFirst("td");
            if (firstTd == null || !firstTd.text().contains("Base Model")) continue;
            Elements next = rows.get(i + 1).getElementsByTag("td");
            if (next.size() >= 2 && next.get(0).text().isBlank()) {
                return collectWords(next.get(1));
            }
        }
        return "";
    }

    private static String collectWords(Element cell) {
        Set<String> words = new LinkedHashSet<>();
        for (Element div : cell.getElementsByTag("div")) {
            if (!BADGE.matcher(div.className()).find()) continue;
            String text = WHITESPACE.matcher(div.text()).replaceAll(" ").trim();
            if (!text.isEmpty() && text.length() < MAX_TRIGGER_WORD_LENGTH) {
                words.add(text);
            }
        }
        for (Element code : cell.select("code, kbd")) {
            String text = code.text().trim();
            if (!text.isEmpty() && text.length() < MAX_TRIGGER_WORD_LENGTH) {
                words.add(text);
            }
        }
        return String.join(", ", words);
    }

    static String jsonSize(JsonNode modelVersion) {
        JsonNode sizeKb = modelVersion.path("files").path(0).path("sizeKB");
        return sizeKb.isNumber() ? SizeFormatter.fromKilobytes(sizeKb.asDouble()) : "";
    }

    private static Element mediaContainer(Document doc) {
        return firstWithClass(doc.getElementsByTag("div"), MEDIA_CONTAINER);
    }

    static Element mediaImage(Document doc) {
        Element container = mediaContainer(doc);
        return container == null ? null : firstWithClass(container.getElementsByTag("img"), EDGE_IMAGE);
    }

    static Element mediaVideo(Document doc) {
        Element container = mediaContainer(doc);
        return container == null ? null : firstWithClass(container.getElementsByTag("video"), EDGE_VIDEO);
    }

    static String bestVideoSource(Element video) {
        if (video == null) return "";
        String first = "";
        for (Element source : video.select("source[src]")) {
            String src = source.attr("src").trim();
            if (src.isEmpty()) continue;
            if (first.isEmpty()) first = src;
            boolean mp4 = source.attr("type").toLowerCase(Locale.ROOT).contains("mp4")
                    || src.toLowerCase(Locale.ROOT).endsWith(".mp4");
            if (mp4) return src;
        }
        return first;
    }

    static String ldImage(JsonNode ld) {
        JsonNode image = ld.path("image");
        if (image.isTextual()) return image.asText();
        if (image.isArray() && !image.isEmpty() && image.get(0).isTextual()) return image.get(0).asText();
        return "";
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static String absolute(Page page, String url) {
        return CivitaiUrls.joinAbsolute(page.baseUrl(), url);
    }

    static String unescapeAmp(String url) {
        return url == null ? "" : url.replace("&amp;", "&").trim();
    }

    private static Element firstWithClass(Elements elements, Pattern classPattern) {
        for (Element el : elements) {
            if (classPattern.matcher(el.className()).find()) {
                return el;
            }
        }
        return null;
    }

    private static String textOf(Element el) {
        return el == null ? "" : el.text();
    }

    private static String attrOf(Element el, String attr) {
        return el == null ? "" : el.attr(attr).trim();
    }

    private static String outerHtmlOf(Element el) {
        return el == null ? "" : el.outerHtml();
    }

    private static String jsonText(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        return v != null && v.isValueNode() && !v.isNull() ? v.asText() : "";
    }

    private static String firstJsonText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = jsonText(node, field);
            if (!value.isBlank()) return value;
        }
        return "";
    }

    private static String joinJsonArray(JsonNode array) {
        if (array == null || !array.isArray()) return "";
        List<String> parts = new ArrayList<>();
        for (JsonNode n : array) {
            String s = n.isValueNode() && !n.isNull() ? n.asText().trim() : "";
            if (!s.isEmpty()) parts.add(s);
        }
        return String.join(", ", parts);
    }
}
