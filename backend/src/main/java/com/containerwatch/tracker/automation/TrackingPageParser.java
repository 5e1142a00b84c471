package com.containerwatch.tracker.automation;

import com.containerwatch.tracker.execution.TrackingNotFoundException;
import com.containerwatch.tracker.model.TrackingResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the tracking result block from the rendered page. The site lays each value out on the
 * line after its label, so the page is flattened into text lines and values are taken positionally.
 */
@Component
public class TrackingPageParser {
    static final String LOCATION_LABEL = "Местонахождение";
    static final String ACTION_LABEL = "Действие";
    static final String COUNTRY_LABEL = "Страна";
    static final String DATE_LABEL = "Дата и время";
    static final String MISSING_VALUE = "N/A";

    public TrackingResult parse(String query, String html) {
        if (html == null || html.isBlank()) {
            throw new TrackingNotFoundException(query);
        }
        return parseLines(query, textLines(Jsoup.parse(html)));
    }

    TrackingResult parseLines(String query, List<String> lines) {
        int location = indexOf(lines, LOCATION_LABEL);
        int action = indexOf(lines, ACTION_LABEL);
        int country = indexOf(lines, COUNTRY_LABEL);
        int date = indexOf(lines, DATE_LABEL);
        if (location < 0 || action < 0 || country < 0 || date < 0) {
            throw new TrackingNotFoundException(query);
        }
        return new TrackingResult(
            query,
            valueAfter(lines, location),
            valueAfter(lines, action),
            valueAfter(lines, country),
            valueAfter(lines, date)
        );
    }

    static List<String> textLines(Document document) {
        List<String> lines = new ArrayList<>();
        Element body = document.body();
        if (body == null) {
            return lines;
        }
        for (Element element : body.getAllElements()) {
            if ("script".equals(element.tagName()) || "style".equals(element.tagName())) {
                continue;
            }
            String text = element.ownText().trim();
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        return lines;
    }

    private static int indexOf(List<String> lines, String label) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(label)) {
                return i;
            }
        }
        return -1;
    }

    private static String valueAfter(List<String> lines, int labelIndex) {
        int next = labelIndex + 1;
        return next < lines.size() ? lines.get(next) : MISSING_VALUE;
    }
}
