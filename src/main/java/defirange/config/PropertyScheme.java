package defirange.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Defines the known properties of an option string together with their default values
 */
public class PropertyScheme {

    private final Map<String, String> defaultValues = new LinkedHashMap<>();

    /**
     * Adds a property that has to be set
     */
    public PropertyScheme add(String param) {
        return add(param, null);
    }

    public PropertyScheme add(String param, String defaultValue) {
        defaultValues.put(param, defaultValue);
        return this;
    }

    /**
     * Parses the option string and fills in the default values of the missing properties
     *
     * @throws ConfigurationError for unknown properties and for missing properties without default
     */
    public Properties parse(String props) {
        Properties properties = new PropertiesParser(props).parse();
        for (Map.Entry<String, String> defaultValEntry : defaultValues.entrySet()) {
            if (!properties.containsKey(defaultValEntry.getKey())) {
                if (defaultValEntry.getValue() == null) {
                    throw new ConfigurationError(String.format("for string \"%s\": property %s not set", props, defaultValEntry.getKey()));
                }
                properties.setProperty(defaultValEntry.getKey(), defaultValEntry.getValue());
            }
        }
        for (String prop : properties.stringPropertyNames()) {
            if (!defaultValues.containsKey(prop)) {
                throw new ConfigurationError(String.format("for string \"%s\": property %s unknown, valid properties are: %s",
                        props, prop, defaultValues.keySet().stream().sorted().collect(Collectors.joining(", "))));
            }
        }
        return properties;
    }

    public String defaultsString() {
        return defaultValues.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(";"));
    }
}
