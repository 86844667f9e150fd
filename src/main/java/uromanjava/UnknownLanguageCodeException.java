package uromanjava;

/**
 * Thrown in strict mode when a language code is not a known ISO 639-3 code.
 *
 * <p>Outside strict mode unknown codes are ignored and the script of the
 * input decides which rules apply.</p>
 */
public class UnknownLanguageCodeException extends IllegalArgumentException {
    private final String languageCode;

    public UnknownLanguageCodeException(String languageCode) {
        super("Unknown ISO 639-3 language code: " + languageCode);
        this.languageCode = languageCode;
    }

    /**
     * @return the rejected code, as supplied by the caller
     */
    public String getLanguageCode() {
        return languageCode;
    }
}
