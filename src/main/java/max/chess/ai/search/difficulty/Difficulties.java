package max.chess.ai.search.difficulty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Named difficulty tiers. Unknown names resolve to the default tier.
 */
public final class Difficulties {
    private static final Logger LOG = LoggerFactory.getLogger(Difficulties.class);

    public static final String RESOURCE = "chess-ai-difficulties.properties";
    public static final String DEFAULT_TIER = "moderate";

    public static final Difficulty BEGINNER = new Difficulty("beginner", 2, 8_000, 0.35, 800);
    public static final Difficulty MODERATE = new Difficulty("moderate", 3, 20_000, 0.05, 1_500);
    public static final Difficulty ADVANCED = new Difficulty("advanced", 4, 60_000, 0, 3_000);

    private final Map<String, Difficulty> tiers;
    private final Difficulty defaultTier;

    private Difficulties(Map<String, Difficulty> tiers, String defaultName) {
        this.tiers = Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
        this.defaultTier = this.tiers.get(defaultName);
        if (defaultTier == null) {
            throw new IllegalArgumentException("Default difficulty " + defaultName + " is not defined");
        }
    }

    /** The three built-in tiers. */
    public static Difficulties defaults() {
        return builder().build();
    }

    /** Built-in tiers, overridden or extended by {@value #RESOURCE} when it is on the classpath. */
    public static Difficulties load() {
        try (InputStream in = Difficulties.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return builder().merge(properties).build();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public static Builder builder() {
        return new Builder()
                .tier(BEGINNER)
                .tier(MODERATE)
                .tier(ADVANCED);
    }

    public Difficulty resolve(String name) {
        if (name == null) {
            return defaultTier;
        }
        Difficulty tier = tiers.get(normalize(name));
        if (tier == null) {
            LOG.debug("Unknown difficulty '{}', using {}", name, defaultTier.name());
            return defaultTier;
        }
        return tier;
    }

    public Difficulty defaultTier() {
        return defaultTier;
    }

    public Map<String, Difficulty> tiers() {
        return tiers;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, Difficulty> tiers = new LinkedHashMap<>();
        private String defaultName = DEFAULT_TIER;

        public Builder tier(Difficulty difficulty) {
            tiers.put(normalize(difficulty.name()), difficulty);
            return this;
        }

        public Builder defaultTier(String name) {
            this.defaultName = normalize(name);
            return this;
        }

        /**
         * Reads {@code <tier>.depth}, {@code <tier>.nodeLimit}, {@code <tier>.randomness} and {@code <tier>.timeMs};
         * missing keys keep the existing tier's value. {@code default} names the fallback tier.
         */
        public Builder merge(Properties properties) {
            for (String key : properties.stringPropertyNames()) {
                if ("default".equals(key)) {
                    defaultTier(properties.getProperty(key));
                    continue;
                }
                int dot = key.lastIndexOf('.');
                if (dot <= 0) {
                    throw new IllegalArgumentException("Unexpected difficulty key " + key);
                }
                String name = normalize(key.substring(0, dot));
                Difficulty current = tiers.getOrDefault(name, new Difficulty(name, 1, 0, 0, 0));
                tiers.put(name, with(current, key.substring(dot + 1), properties.getProperty(key).trim()));
            }
            return this;
        }

        private static Difficulty with(Difficulty d, String field, String value) {
            try {
                return switch (field) {
                    case "depth" -> new Difficulty(d.name(), Integer.parseInt(value), d.nodeLimit(), d.randomness(), d.timeMs());
                    case "nodeLimit" -> new Difficulty(d.name(), d.depth(), Long.parseLong(value), d.randomness(), d.timeMs());
                    case "randomness" -> new Difficulty(d.name(), d.depth(), d.nodeLimit(), Double.parseDouble(value), d.timeMs());
                    case "timeMs" -> new Difficulty(d.name(), d.depth(), d.nodeLimit(), d.randomness(), Long.parseLong(value));
                    default -> throw new IllegalArgumentException("Unknown difficulty setting " + d.name() + "." + field);
                };
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value '" + value + "' for " + d.name() + "." + field, e);
            }
        }

        public Difficulties build() {
            return new Difficulties(tiers, defaultName);
        }
    }
}
