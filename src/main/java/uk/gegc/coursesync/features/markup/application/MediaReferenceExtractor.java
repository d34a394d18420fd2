package uk.gegc.coursesync.features.markup.application;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import uk.gegc.coursesync.features.markup.domain.model.MediaReference;
import uk.gegc.coursesync.shared.util.UrlPaths;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists images, embedded media and linked documents in platform HTML, with the platform file id when
 * the URL points at a course file.
 */
@Component
public class MediaReferenceExtractor {

    private static final Pattern FILE_ID = Pattern.compile("/files/(\\d+)(?:/|$|\\?)");
    private static final List<String> FILE_INDICATORS = List.of(
            "/files/", "/download", ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx", ".zip", ".csv");

    public List<MediaReference> extract(String html) {
        List<MediaReference> references = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return references;
        }
        Set<String> seen = new LinkedHashSet<>();
        Document document = Jsoup.parse(html);
        for (Element img : document.select("img[src]")) {
            add(references, seen, "image", img.attr("src"), img.attr("alt"));
        }
        for (Element media : document.select("video[src], audio[src], source[src]")) {
            add(references, seen, media.normalName().equals("audio") ? "audio" : "video", media.attr("src"), "");
        }
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            if (looksLikeFile(href)) {
                add(references, seen, "file", href, link.text().strip());
            }
        }
        return references;
    }

    public static String remoteFileId(String url) {
        if (url == null) {
            return null;
        }
        Matcher m = FILE_ID.matcher(url);
        return m.find() ? m.group(1) : null;
    }

    static boolean looksLikeFile(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return FILE_INDICATORS.stream().anyMatch(lower::contains);
    }

    static String filenameOf(String url) {
        try {
            String path = URI.create(url.replace(" ", "%20")).getPath();
            if (path == null) {
                return "";
            }
            String decoded = UrlPaths.decodePath(path);
            int slash = decoded.lastIndexOf('/');
            return slash >= 0 ? decoded.substring(slash + 1) : decoded;
        } catch (IllegalArgumentException ex) {
            return "";
        }
    }

    private static void add(List<MediaReference> references, Set<String> seen, String kind, String url, String alt) {
        if (url == null || url.isBlank() || url.startsWith("data:") || !seen.add(url)) {
            return;
        }
        references.add(new MediaReference(kind, url, filenameOf(url), alt, remoteFileId(url)));
    }
}
