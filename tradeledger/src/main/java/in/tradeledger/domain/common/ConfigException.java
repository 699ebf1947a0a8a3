package in.tradeledger.domain.common;

/**
 * Thrown when a required setting (credentials, account) is missing.
 * Not retried automatically: an operator has to fix the configuration.
 */
public class ConfigException extends RuntimeException {

    private final String setting;

    public ConfigException(String setting, String message) {
        super(String.format("[CONFIG:%s] %s", setting, message));
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
