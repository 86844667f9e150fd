package uromanjava;

/**
 * Thrown for an output format selector other than {@code str}, {@code edges},
 * {@code alts} or {@code lattice}.
 */
public class InvalidFormatException extends IllegalArgumentException {

    public InvalidFormatException(String format) {
        super("Invalid format '" + format + "'. Must be 'str', 'edges', 'alts', or 'lattice'.");
    }
}
