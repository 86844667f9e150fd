package uromanjava;

/**
 * Thrown when rule data is missing or malformed.
 *
 * <p>Rule data is validated completely while the {@link RuleStore} loads, so
 * this exception only ever surfaces during initialization, never while
 * romanizing.</p>
 */
public class RuleLoadException extends RuntimeException {

    public RuleLoadException(String message) {
        super(message);
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception pointing at one line of a rule file.
     *
     * @param file   file or resource name
     * @param lineNo 1-based line number
     * @param detail what is wrong
     * @param raw    the offending line
     * @return the exception
     */
    static RuleLoadException atLine(String file, int lineNo, String detail, String raw) {
        return new RuleLoadException(file + ":" + lineNo + ": " + detail + ": " + raw);
    }
}
