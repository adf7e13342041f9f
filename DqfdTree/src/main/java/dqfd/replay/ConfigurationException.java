package dqfd.replay;

// Invalid combination of settings, detected once at construction time.
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
