package work.lcod.staging.render;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces {@code ${key}} references with context values. {@code $${} yields a literal
 * {@code ${}. Unknown references are kept as written unless the renderer is strict.
 */
public final class PlaceholderRenderer implements TemplateRenderer {
    private final boolean strict;

    public PlaceholderRenderer() {
        this(false);
    }

    public PlaceholderRenderer(boolean strict) {
        this.strict = strict;
    }

    public boolean strict() {
        return strict;
    }

    @Override
    public String render(Path template, Map<String, String> context) throws IOException {
        String text = Files.readString(template, charset());
        List<String> missing = new ArrayList<>();
        String rendered = render(text, context, missing);
        if (strict && !missing.isEmpty()) {
            throw new RenderException(template, missing);
        }
        return rendered;
    }

    static String render(String template, Map<String, String> context, List<String> missing) {
        StringBuilder builder = new StringBuilder(template.length());
        for (int i = 0; i < template.length(); i++) {
            char ch = template.charAt(i);
            if (ch != '$') {
                builder.append(ch);
                continue;
            }
            if (template.startsWith("$${", i)) {
                builder.append("${");
                i += 2;
                continue;
            }
            if (!template.startsWith("${", i)) {
                builder.append(ch);
                continue;
            }
            int close = template.indexOf('}', i + 2);
            if (close == -1) {
                builder.append(template.substring(i));
                break;
            }
            String token = template.substring(i + 2, close).trim();
            String resolved = token.isEmpty() ? null : context.get(token);
            if (resolved == null) {
                missing.add(token);
                builder.append(template, i, close + 1);
            } else {
                builder.append(resolved);
            }
            i = close;
        }
        return builder.toString();
    }
}
