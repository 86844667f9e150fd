package uromanjava;

/**
 * Settings of a {@link Uroman} instance. Immutable; create with {@link #builder()}.
 *
 * <pre>{@code
 * UromanOptions opts = UromanOptions.builder().strict(true).build();
 * }</pre>
 */
public final class UromanOptions {
    /**
     * Line count above which {@link Uroman#romanizeText} works in parallel.
     */
    public static final int DEFAULT_PARALLEL_LINES = 256;
    /**
     * Text length (chars) above which {@link Uroman#romanizeText} works in parallel.
     */
    public static final int DEFAULT_PARALLEL_CHARS = 100_000;

    private final boolean strict;
    private final String ruleDirectory;
    private final int parallelLines;
    private final int parallelChars;

    private UromanOptions(Builder b) {
        this.strict = b.strict;
        this.ruleDirectory = b.ruleDirectory;
        this.parallelLines = b.parallelLines;
        this.parallelChars = b.parallelChars;
    }

    /**
     * @return default options: lenient language codes, default rule data
     */
    public static UromanOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if unknown language codes are rejected
     */
    public boolean isStrict() {
        return strict;
    }

    /**
     * @return the rule directory to load instead of the default rule data, or {@code null}
     */
    public String getRuleDirectory() {
        return ruleDirectory;
    }

    public int getParallelLines() {
        return parallelLines;
    }

    public int getParallelChars() {
        return parallelChars;
    }

    @Override
    public String toString() {
        return "UromanOptions(strict=" + strict + ", ruleDirectory=" + ruleDirectory
                + ", parallelLines=" + parallelLines + ", parallelChars=" + parallelChars + ")";
    }

    /**
     * Builder for {@link UromanOptions}.
     */
    public static final class Builder {
        private boolean strict;
        private String ruleDirectory;
        private int parallelLines = DEFAULT_PARALLEL_LINES;
        private int parallelChars = DEFAULT_PARALLEL_CHARS;

        private Builder() {
        }

        /**
         * @param strict reject language codes missing from the language registry
         */
        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        /**
         * @param ruleDirectory directory (file system or class path) holding {@code rulesets.json}
         */
        public Builder ruleDirectory(String ruleDirectory) {
            this.ruleDirectory = ruleDirectory;
            return this;
        }

        public Builder parallelLines(int parallelLines) {
            if (parallelLines < 1) throw new IllegalArgumentException("parallelLines must be positive");
            this.parallelLines = parallelLines;
            return this;
        }

        public Builder parallelChars(int parallelChars) {
            if (parallelChars < 1) throw new IllegalArgumentException("parallelChars must be positive");
            this.parallelChars = parallelChars;
            return this;
        }

        public UromanOptions build() {
            return new UromanOptions(this);
        }
    }
}
