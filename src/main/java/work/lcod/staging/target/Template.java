package work.lcod.staging.target;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import work.lcod.staging.shared.InvalidConfigurationException;

/**
 * Recognizes target definition files by name and loads their content.
 *
 * <p>The target name is read from capture group 1 of the first match of the pattern against the
 * file name. Matching uses {@link Matcher#find()}, so the pattern only needs to occur somewhere in
 * the name.</p>
 */
public interface Template {
    /** Lower or upper case alphanumerics, dashes and underscores. Dots and slashes are excluded. */
    String TARGET_PATTERN = "([a-zA-Z0-9_\\-]*)";

    boolean matches(String fileName);

    Optional<String> extractName(String fileName);

    Map<String, String> load(InputStream stream) throws IOException;

    String patternSource();

    static Template of(String mask) {
        return of(mask, null);
    }

    static Template of(Pattern pattern) {
        return of(pattern, null);
    }

    static Template of(String mask, PropertiesLoader loader) {
        return of(compile(mask), loader);
    }

    static Template of(Pattern pattern, PropertiesLoader loader) {
        return new PatternTemplate(pattern, loader == null ? Loaders.properties() : loader);
    }

    /**
     * Builds a template from a map holding either a {@code pattern} ({@link Pattern} or string)
     * or a {@code mask}, and optionally a {@code load} entry ({@link PropertiesLoader}).
     */
    static Template fromMap(Map<String, ?> values) {
        Object rawPattern = values.containsKey("pattern") ? values.get("pattern") : values.get("mask");
        Pattern pattern;
        if (rawPattern instanceof Pattern compiled) {
            pattern = compiled;
        } else if (rawPattern != null) {
            pattern = compile(String.valueOf(rawPattern));
        } else {
            throw new InvalidConfigurationException("Define a string mask or regular expression pattern: " + values);
        }
        Object load = values.get("load");
        if (load != null && !(load instanceof PropertiesLoader)) {
            throw new InvalidConfigurationException("Template loader must be a PropertiesLoader: " + load);
        }
        return of(pattern, (PropertiesLoader) load);
    }

    static Pattern compile(String mask) {
        if (mask == null) {
            throw new InvalidConfigurationException("Not a valid context mask: null");
        }
        try {
            return Pattern.compile(mask);
        } catch (PatternSyntaxException ex) {
            throw new InvalidConfigurationException("Not a valid context mask: " + mask, ex);
        }
    }

    record PatternTemplate(Pattern pattern, PropertiesLoader loader) implements Template {
        public PatternTemplate {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(loader, "loader");
        }

        @Override
        public boolean matches(String fileName) {
            return pattern.matcher(fileName).find();
        }

        @Override
        public Optional<String> extractName(String fileName) {
            Matcher matcher = pattern.matcher(fileName);
            if (!matcher.find() || matcher.groupCount() < 1) {
                return Optional.empty();
            }
            return Optional.ofNullable(matcher.group(1));
        }

        @Override
        public Map<String, String> load(InputStream stream) throws IOException {
            return loader.load(stream);
        }

        @Override
        public String patternSource() {
            return pattern.pattern();
        }

        @Override
        public String toString() {
            return "Template[" + pattern.pattern() + "]";
        }
    }
}
