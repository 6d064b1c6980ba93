package edu.umich.andykong.spikeshepherd.paramhandling;

/**
 * Raised for malformed configuration before any signal processing starts.
 */
public class InvalidParameterException extends IllegalArgumentException {
    private final String key;

    public InvalidParameterException(String key, String message) {
        super(key == null ? message : key + ": " + message);
        this.key = key;
    }

    public InvalidParameterException(String key, String message, Throwable cause) {
        super(key == null ? message : key + ": " + message, cause);
        this.key = key;
    }

    /**
     * @return the offending parameter key, or null when the problem is not tied to one parameter
     */
    public String getKey() {
        return key;
    }
}
