package express.mvp.tenacity.client;

/**
 * Thrown when client settings are invalid: a malformed server address, an out-of-range option or
 * an unreadable configuration file.
 *
 * <p>Configuration errors are reported synchronously and never retried.
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
