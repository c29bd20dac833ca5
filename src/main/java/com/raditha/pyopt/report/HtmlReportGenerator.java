package com.raditha.pyopt.report;

import com.raditha.pyopt.model.NestedLoop;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the optimization report from an HTML template on the classpath.
 * <p>
 * The template holds the placeholders {@code {{file_name}}},
 * {@code {{static_analysis}}}, {@code {{nested_loops}}} and
 * {@code {{dynamic_analysis}}}. Every substituted value is HTML escaped.
 */
public class HtmlReportGenerator {

    public static final String DEFAULT_TEMPLATE = "templates/report_template.html";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private final String templateResource;
    private final SuggestionFormatter formatter;

    public HtmlReportGenerator() {
        this(DEFAULT_TEMPLATE, new SuggestionFormatter());
    }

    public HtmlReportGenerator(String templateResource, SuggestionFormatter formatter) {
        this.templateResource = templateResource;
        this.formatter = formatter;
    }

    /**
     * Fill the template.
     *
     * @param fileName         script the report is about
     * @param staticAnalysis   suggestion lines, one list item each
     * @param nestedLoops      nested loop findings, one table row each
     * @param dynamicAnalysis  profiler output, shown preformatted
     * @throws IOException if the template cannot be loaded
     */
    public String generate(String fileName, List<String> staticAnalysis, List<NestedLoop> nestedLoops,
                           String dynamicAnalysis) throws IOException {
        Map<String, String> values = Map.of(
                "file_name", escape(fileName),
                "static_analysis", renderSuggestions(staticAnalysis),
                "nested_loops", renderNestedLoops(nestedLoops),
                "dynamic_analysis", escape(dynamicAnalysis));

        // one pass, so substituted text is never scanned for placeholders
        Matcher matcher = PLACEHOLDER.matcher(loadTemplate());
        StringBuilder html = new StringBuilder();
        while (matcher.find()) {
            String value = values.getOrDefault(matcher.group(1), matcher.group());
            matcher.appendReplacement(html, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(html);
        return html.toString();
    }

    private String loadTemplate() throws IOException {
        try (InputStream in = HtmlReportGenerator.class.getClassLoader().getResourceAsStream(templateResource)) {
            if (in == null) {
                throw new IOException("Report template not found on classpath: " + templateResource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String renderSuggestions(List<String> suggestions) {
        if (suggestions.isEmpty()) {
            return "<li class=\"none\">No static analysis suggestions.</li>";
        }
        StringBuilder html = new StringBuilder();
        for (String suggestion : suggestions) {
            html.append("<li>").append(escape(suggestion)).append("</li>\n");
        }
        return html.toString().stripTrailing();
    }

    private String renderNestedLoops(List<NestedLoop> loops) {
        if (loops.isEmpty()) {
            return "<tr><td colspan=\"3\">No nested loops found.</td></tr>";
        }
        StringBuilder html = new StringBuilder();
        for (NestedLoop loop : loops) {
            html.append("<tr><td>").append(loop.line())
                    .append("</td><td>").append(loop.depth())
                    .append("</td><td>").append(escape(formatter.nestedLoopAdvice(loop)))
                    .append("</td></tr>\n");
        }
        return html.toString().stripTrailing();
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
