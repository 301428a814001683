package defirange.config;

import java.util.Properties;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Parses option strings of the form {@code key=value;key={value with ;}}, whitespace
 * between the tokens is ignored
 */
public class PropertiesParser {

    private static final int EOF = -1;

    private final String input;
    private int pos;

    public PropertiesParser(String input) {
        this.input = input;
        this.pos = 0;
        skipWhitespace();
    }

    public Properties parse() {
        Properties props = new Properties();
        while (current() != EOF) {
            Pair<String, String> prop = property();
            if (props.containsKey(prop.getKey())) {
                throw error(String.format("property %s is set twice", prop.getKey()));
            }
            props.setProperty(prop.getKey(), prop.getValue());
            if (current() == ';') {
                advance();
            } else if (current() != EOF) {
                throw error("expected ;");
            }
        }
        return props;
    }

    private Pair<String, String> property() {
        StringBuilder key = new StringBuilder();
        while (Character.isJavaIdentifierPart(current()) || current() == '.') {
            key.appendCodePoint(current());
            advance();
        }
        if (key.length() == 0) {
            throw error("expected a property name");
        }
        if (current() != '=') {
            throw error("expected =");
        }
        advance();
        return Pair.of(key.toString(), value());
    }

    private String value() {
        StringBuilder builder = new StringBuilder();
        int depth = 0;
        while (depth > 0 || (current() != ';' && current() != EOF)) {
            if (current() == EOF) {
                throw error("unclosed {");
            }
            if (current() == '{') {
                depth++;
            } else if (current() == '}') {
                depth--;
            }
            builder.appendCodePoint(current());
            advance();
        }
        String value = builder.toString();
        if (value.isEmpty()) {
            throw error("expected a value");
        }
        return value.charAt(0) == '{' && value.endsWith("}") ? value.substring(1, value.length() - 1) : value;
    }

    private int current() {
        return pos < input.length() ? input.charAt(pos) : EOF;
    }

    private void advance() {
        pos++;
        skipWhitespace();
    }

    private void skipWhitespace() {
        while (Character.isWhitespace(current())) {
            pos++;
        }
    }

    /**
     * Marks the current position in the input: {@code widen=3;[expected =]narrow}
     */
    private ConfigurationError error(String msg) {
        int at = Math.min(pos, input.length());
        return new ConfigurationError(String.format("%s[%s]%s", input.substring(0, at), msg, input.substring(at)));
    }
}
