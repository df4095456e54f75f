package org.bindforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Identifies the configured item either by exact name or by a regular expression.
 */
public sealed interface Ident permits Ident.Name, Ident.Regex {

    boolean matches(String name);

    record Name(String value) implements Ident {
        @Override
        public boolean matches(String name) {
            return value.equals(name);
        }
    }

    record Regex(Pattern pattern) implements Ident {
        @Override
        public boolean matches(String name) {
            return pattern.matcher(name).matches();
        }

        @Override
        public String toString() {
            return "Regex[" + pattern.pattern() + "]";
        }
    }

    /**
     * Reads the {@code name} or {@code pattern} key of a configuration block.
     * @param config The block of one function or parameter entry.
     * @return The identifier.
     * @throws ConfigException.BadValue if neither key is present or the pattern is not a valid regular expression.
     */
    static Ident fromConfig(Config config) {
        if (config.hasPath("name")) {
            return new Name(config.getString("name"));
        }
        if (!config.hasPath("pattern")) {
            throw new ConfigException.BadValue(config.origin(), "name", "Entry needs a 'name' or a 'pattern'");
        }
        String pattern = config.getString("pattern");
        try {
            return new Regex(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            throw new ConfigException.BadValue(config.origin(), "pattern",
                    "Invalid regular expression '" + pattern + "': " + e.getDescription(), e);
        }
    }
}
