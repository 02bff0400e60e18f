package work.lcod.staging.defaults;

import java.util.Objects;

/**
 * Options controlling how defaults are merged into generated property files.
 *
 * @param sort sort the merged lines lexicographically (applies across defaults and own lines)
 * @param trim drop lines that are empty after trimming
 * @param structured require every file generated in one batch to define the same keys
 * @param prepend place the file's own lines before the defaults instead of after them
 * @param defaultsFileExtension suffix identifying defaults files
 */
public record MergeOptions(
    boolean sort,
    boolean trim,
    boolean structured,
    boolean prepend,
    String defaultsFileExtension
) {
    public static final String DEFAULT_DEFAULTS_FILE_EXTENSION = ".defaults.vtl";

    public MergeOptions {
        Objects.requireNonNull(defaultsFileExtension, "defaultsFileExtension");
        if (defaultsFileExtension.isEmpty()) {
            throw new IllegalArgumentException("defaultsFileExtension must not be empty");
        }
    }

    public static MergeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .sort(sort)
            .trim(trim)
            .structured(structured)
            .prepend(prepend)
            .defaultsFileExtension(defaultsFileExtension);
    }

    public static final class Builder {
        private boolean sort;
        private boolean trim;
        private boolean structured;
        private boolean prepend;
        private String defaultsFileExtension = DEFAULT_DEFAULTS_FILE_EXTENSION;

        public Builder sort(boolean sort) {
            this.sort = sort;
            return this;
        }

        public Builder trim(boolean trim) {
            this.trim = trim;
            return this;
        }

        public Builder structured(boolean structured) {
            this.structured = structured;
            return this;
        }

        public Builder prepend(boolean prepend) {
            this.prepend = prepend;
            return this;
        }

        public Builder defaultsFileExtension(String defaultsFileExtension) {
            this.defaultsFileExtension = defaultsFileExtension;
            return this;
        }

        public MergeOptions build() {
            return new MergeOptions(sort, trim, structured, prepend, defaultsFileExtension);
        }
    }
}
