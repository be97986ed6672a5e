package io.stakechain.core.protocol;

/**
 * Parsing for governance parameter values. Anything unparsable or out of range is an
 * {@link ChainError#INVALID_PROPOSAL}.
 */
public final class ParameterValues {

    private ParameterValues() {}

    public static long parseLong(String name, String value, long min, long max) {
        long parsed;
        try {
            parsed = Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new ChainException(ChainError.INVALID_PROPOSAL, name + " must be an integer, got " + value, e);
        }
        if (parsed < min || parsed > max) {
            throw new ChainException(ChainError.INVALID_PROPOSAL,
                    name + " must be in [" + min + ", " + max + "], got " + parsed);
        }
        return parsed;
    }

    public static int parseInt(String name, String value, int min, int max) {
        return (int) parseLong(name, value, min, max);
    }

    /** A fraction in [0, 1]. */
    public static double parseFraction(String name, String value) {
        double parsed;
        try {
            parsed = Double.parseDouble(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new ChainException(ChainError.INVALID_PROPOSAL, name + " must be a number, got " + value, e);
        }
        if (!(parsed >= 0.0 && parsed <= 1.0)) {
            throw new ChainException(ChainError.INVALID_PROPOSAL, name + " must be in [0, 1], got " + value);
        }
        return parsed;
    }

    /** Only the literals {@code true} and {@code false}. */
    public static boolean parseBoolean(String name, String value) {
        if ("true".equals(value)) return true;
        if ("false".equals(value)) return false;
        throw new ChainException(ChainError.INVALID_PROPOSAL, name + " must be true or false, got " + value);
    }
}
