package com.sampleci.tracker.diff;

import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * Renders diff groups as a two-column HTML table (expected | actual).
 *
 * Both render modes share the same fragment; DOWNLOAD only wraps it in a
 * standalone document so the saved file opens on its own. Output depends on
 * nothing but the groups, so identical input renders identically.
 */
public final class HtmlDiffRenderer {

    // Equal lines kept visible on each side of a collapsed run.
    static final int CONTEXT_LINES = 3;

    private static final String STYLES = """
            .sampleci-diff { font-family: monospace; font-size: 13px; }
            .sampleci-diff .diff-summary { margin: 4px 0 8px; font-family: sans-serif; }
            .sampleci-diff table { border-collapse: collapse; width: 100%; table-layout: fixed; }
            .sampleci-diff th { background: #f0f0f0; text-align: left; padding: 2px 6px; }
            .sampleci-diff td { padding: 0 6px; vertical-align: top; white-space: pre-wrap; word-break: break-all; }
            .sampleci-diff td.ln { width: 4em; color: #888; text-align: right; background: #fafafa; }
            .sampleci-diff th.ln { width: 4em; }
            .sampleci-diff tr.diff-skip td { text-align: center; color: #888; background: #f6f8fa; }
            .sampleci-diff td.del { background: #ffeef0; }
            .sampleci-diff td.ins { background: #e6ffed; }
            .sampleci-diff span.diff-del { background: #fdb8c0; }
            .sampleci-diff span.diff-ins { background: #acf2bd; }
            """;

    private HtmlDiffRenderer() {}

    public static String render(List<DiffGroup> groups, RenderMode mode) {
        String fragment = renderFragment(groups);
        if (mode != RenderMode.DOWNLOAD) {
            return fragment;
        }
        return "<!DOCTYPE html>\n"
             + "<html lang=\"en\">\n"
             + "<head>\n"
             + "<meta charset=\"UTF-8\">\n"
             + "<title>Output diff</title>\n"
             + "</head>\n"
             + "<body>\n"
             + fragment
             + "</body>\n"
             + "</html>\n";
    }

    private static String renderFragment(List<DiffGroup> groups) {
        StringBuilder html = new StringBuilder();
        html.append("<div class=\"sampleci-diff\">\n");
        html.append("<style>\n").append(STYLES).append("</style>\n");
        html.append("<p class=\"diff-summary\">").append(summary(groups)).append("</p>\n");

        html.append("<table>\n");
        html.append("<thead><tr><th class=\"ln\">#</th><th>Expected</th>")
            .append("<th class=\"ln\">#</th><th>Actual</th></tr></thead>\n");
        html.append("<tbody>\n");
        for (DiffGroup group : groups) {
            switch (group.kind()) {
                case EQUAL   -> appendEqual(html, group);
                case CHANGED -> appendChanged(html, group);
                case REMOVED, ADDED -> appendOneSided(html, group);
            }
        }
        html.append("</tbody>\n");
        html.append("</table>\n");
        html.append("</div>\n");
        return html.toString();
    }

    static String summary(List<DiffGroup> groups) {
        int changed = DiffEngine.count(groups, DiffKind.CHANGED);
        int added   = DiffEngine.count(groups, DiffKind.ADDED);
        int removed = DiffEngine.count(groups, DiffKind.REMOVED);
        if (changed + added + removed == 0) {
            return "No differences";
        }
        return changed + " changed, " + added + " added, " + removed + " removed";
    }

    // ------------------------------------------------------------------
    // Rows
    // ------------------------------------------------------------------

    private static void appendEqual(StringBuilder html, DiffGroup group) {
        int size = group.expected().size();
        if (size <= 2 * CONTEXT_LINES + 1) {
            for (int k = 0; k < size; k++) {
                appendEqualRow(html, group, k);
            }
            return;
        }
        for (int k = 0; k < CONTEXT_LINES; k++) {
            appendEqualRow(html, group, k);
        }
        int hidden = size - 2 * CONTEXT_LINES;
        html.append("<tr class=\"diff-skip\"><td colspan=\"4\">... ")
            .append(hidden).append(" identical lines ...</td></tr>\n");
        for (int k = size - CONTEXT_LINES; k < size; k++) {
            appendEqualRow(html, group, k);
        }
    }

    private static void appendEqualRow(StringBuilder html, DiffGroup group, int k) {
        String text = escape(group.expected().get(k));
        html.append("<tr class=\"diff-equal\">")
            .append("<td class=\"ln\">").append(group.expectedStart() + k).append("</td>")
            .append("<td>").append(text).append("</td>")
            .append("<td class=\"ln\">").append(group.actualStart() + k).append("</td>")
            .append("<td>").append(text).append("</td>")
            .append("</tr>\n");
    }

    private static void appendChanged(StringBuilder html, DiffGroup group) {
        List<String> expected = group.expected();
        List<String> actual   = group.actual();
        int rows = Math.max(expected.size(), actual.size());
        for (int k = 0; k < rows; k++) {
            html.append("<tr class=\"diff-changed\">");
            if (k < expected.size() && k < actual.size()) {
                String[] marked = highlight(expected.get(k), actual.get(k));
                appendCell(html, group.expectedStart() + k, "del", marked[0]);
                appendCell(html, group.actualStart() + k, "ins", marked[1]);
            } else if (k < expected.size()) {
                appendCell(html, group.expectedStart() + k, "del", escape(expected.get(k)));
                appendEmptyCell(html);
            } else {
                appendEmptyCell(html);
                appendCell(html, group.actualStart() + k, "ins", escape(actual.get(k)));
            }
            html.append("</tr>\n");
        }
    }

    private static void appendOneSided(StringBuilder html, DiffGroup group) {
        boolean removed = group.kind() == DiffKind.REMOVED;
        List<String> lines = removed ? group.expected() : group.actual();
        for (int k = 0; k < lines.size(); k++) {
            String text = escape(lines.get(k));
            if (removed) {
                html.append("<tr class=\"diff-removed\">");
                appendCell(html, group.expectedStart() + k, "del", text);
                appendEmptyCell(html);
            } else {
                html.append("<tr class=\"diff-added\">");
                appendEmptyCell(html);
                appendCell(html, group.actualStart() + k, "ins", text);
            }
            html.append("</tr>\n");
        }
    }

    private static void appendCell(StringBuilder html, int lineNumber, String cssClass, String content) {
        html.append("<td class=\"ln\">").append(lineNumber).append("</td>")
            .append("<td class=\"").append(cssClass).append("\">").append(content).append("</td>");
    }

    private static void appendEmptyCell(StringBuilder html) {
        html.append("<td class=\"ln\"></td><td></td>");
    }

    // ------------------------------------------------------------------
    // Intra-line highlighting
    // ------------------------------------------------------------------

    /**
     * Escape both lines and wrap the part between their common prefix and
     * common suffix in a highlight span.
     *
     * @return {expectedHtml, actualHtml}
     */
    static String[] highlight(String expected, String actual) {
        int max = Math.min(expected.length(), actual.length());
        int prefix = 0;
        while (prefix < max && expected.charAt(prefix) == actual.charAt(prefix)) {
            prefix++;
        }
        // never split a surrogate pair
        if (prefix > 0 && Character.isHighSurrogate(expected.charAt(prefix - 1))) {
            prefix--;
        }
        int suffix = 0;
        while (suffix < max - prefix
                && expected.charAt(expected.length() - 1 - suffix) == actual.charAt(actual.length() - 1 - suffix)) {
            suffix++;
        }
        if (suffix > 0 && Character.isLowSurrogate(expected.charAt(expected.length() - suffix))) {
            suffix--;
        }
        return new String[] {
                mark(expected, prefix, suffix, "diff-del"),
                mark(actual,   prefix, suffix, "diff-ins")
        };
    }

    private static String mark(String line, int prefix, int suffix, String cssClass) {
        String middle = line.substring(prefix, line.length() - suffix);
        StringBuilder out = new StringBuilder(escape(line.substring(0, prefix)));
        if (!middle.isEmpty()) {
            out.append("<span class=\"").append(cssClass).append("\">")
               .append(escape(middle))
               .append("</span>");
        }
        out.append(escape(line.substring(line.length() - suffix)));
        return out.toString();
    }

    private static String escape(String text) {
        return HtmlUtils.htmlEscape(text, "UTF-8");
    }
}
