package com.trendsentinel.core.config;

import com.trendsentinel.core.error.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Format</h3>
 * <p>
 * A flat mapping of snake_case keys, for example:
 * </p>
 *
 * <pre>
 * detectors: [zscore, iqr, isolation]
 * isolation_seed: 42
 * smoothing_mode: double
 * forecast_horizon: 5
 * </pre>
 *
 * <h3>Validation</h3>
 * <p>
 * Duplicate keys, unknown keys and values of the wrong type are rejected, and
 * the result is validated by {@link AnalysisConfig.Builder#build()}, so a bad
 * file <strong>fails fast</strong> with an {@link InvalidParameterException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYSIS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private static final Map<String, BiConsumer<AnalysisConfig.Builder, Object>> SETTERS = new LinkedHashMap<>();

    static {
        SETTERS.put("detectors", (b, v) -> b.detectors(toDetectors(v)));
        SETTERS.put("z_threshold", (b, v) -> b.zThreshold(toDouble(v)));
        SETTERS.put("z_window", (b, v) -> b.zWindow(toInteger(v)));
        SETTERS.put("iqr_multiplier", (b, v) -> b.iqrMultiplier(toDouble(v)));
        SETTERS.put("iqr_window", (b, v) -> b.iqrWindow(toInteger(v)));
        SETTERS.put("isolation_seed", (b, v) -> b.isolationSeed(toLong(v)));
        SETTERS.put("isolation_score_threshold", (b, v) -> b.isolationScoreThreshold(toDouble(v)));
        SETTERS.put("isolation_trees", (b, v) -> b.isolationTrees(toInteger(v)));
        SETTERS.put("isolation_sample_size", (b, v) -> b.isolationSampleSize(toInteger(v)));
        SETTERS.put("moving_average_window", (b, v) -> b.movingAverageWindow(toInteger(v)));
        SETTERS.put("moving_average_threshold", (b, v) -> b.movingAverageThreshold(toDouble(v)));
        SETTERS.put("consensus_majority_fraction", (b, v) -> b.consensusMajorityFraction(toDouble(v)));
        SETTERS.put("trend_analysis_enabled", (b, v) -> b.trendAnalysisEnabled(toBoolean(v)));
        SETTERS.put("decomposition_enabled", (b, v) -> b.decompositionEnabled(toBoolean(v)));
        SETTERS.put("seasonal_period", (b, v) -> b.seasonalPeriod(toInteger(v)));
        SETTERS.put("seasonality_min_correlation", (b, v) -> b.seasonalityMinCorrelation(toDouble(v)));
        SETTERS.put("decomposition_mode", (b, v) -> b.decompositionMode(toEnum(DecompositionMode.class, v)));
        SETTERS.put("smoothing_mode", (b, v) -> b.smoothingMode(toEnum(SmoothingMode.class, v)));
        SETTERS.put("alpha", (b, v) -> b.alpha(toDouble(v)));
        SETTERS.put("beta", (b, v) -> b.beta(toDouble(v)));
        SETTERS.put("gamma", (b, v) -> b.gamma(toDouble(v)));
        SETTERS.put("forecast_horizon", (b, v) -> b.forecastHorizon(toInteger(v)));
        SETTERS.put("confidence_z", (b, v) -> b.confidenceZ(toDouble(v)));
        SETTERS.put("trend_noise_floor", (b, v) -> b.trendNoiseFloor(toDouble(v)));
        SETTERS.put("gap_fill_policy", (b, v) -> b.gapFillPolicy(toEnum(GapFillPolicy.class, v)));
        SETTERS.put("duplicate_policy", (b, v) -> b.duplicatePolicy(toEnum(DuplicatePolicy.class, v)));
    }

    private AnalysisConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using the process environment.
     *
     * @return parsed and validated configuration
     * @throws InvalidParameterException if the configuration is invalid
     */
    public static AnalysisConfig load() {
        return load(System.getenv());
    }

    /**
     * Load the configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code ANALYSIS_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@code analysis.yml} on the classpath.</li>
     * </ol>
     *
     * @param env environment variables to resolve the path from
     * @return parsed and validated configuration
     * @throws InvalidParameterException if the configuration is invalid
     */
    public static AnalysisConfig load(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        String envPath = env.get(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analysis configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (envPath != null && !envPath.isBlank()) {
            LOG.warn("{}={} does not exist, falling back to classpath", ENV_CONFIG_PATH, envPath);
        }
        LOG.info("Loading analysis configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException  if the file does not exist
     * @throws IllegalStateException     if reading fails
     * @throws InvalidParameterException if the configuration is invalid
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException  if the resource does not exist
     * @throws IllegalStateException     if reading fails
     * @throws InvalidParameterException if the configuration is invalid
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Build a configuration from already-parsed snake_case key/value pairs.
     *
     * @param values configuration values; must not be {@code null}
     * @return validated configuration
     * @throws InvalidParameterException if a key is unknown, a value has the
     *                                   wrong type, or validation fails
     */
    public static AnalysisConfig fromMap(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        AnalysisConfig.Builder builder = AnalysisConfig.builder();
        List<String> errors = new ArrayList<>();

        for (Map.Entry<String, ?> entry : values.entrySet()) {
            BiConsumer<AnalysisConfig.Builder, Object> setter = SETTERS.get(entry.getKey());
            if (setter == null) {
                errors.add("unknown key '" + entry.getKey() + "'");
                continue;
            }
            if (entry.getValue() == null) {
                // explicit null keeps the default
                continue;
            }
            try {
                setter.accept(builder, entry.getValue());
            } catch (IllegalArgumentException | ArithmeticException e) {
                errors.add("'" + entry.getKey() + "': " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidParameterException(
                    "analysis configuration is invalid:\n  - " + String.join("\n  - ", errors));
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidParameterException("analysis configuration is not valid YAML: " + e.getMessage(), e);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        if (document == null) {
            LOG.warn("Analysis configuration is empty, using defaults");
        } else if (document instanceof Map<?, ?> map) {
            map.forEach((k, v) -> values.put(String.valueOf(k), v));
        } else {
            throw new InvalidParameterException(
                    "analysis configuration must be a mapping, got: " + document.getClass().getSimpleName());
        }

        AnalysisConfig config = fromMap(values);
        LOG.info("Loaded analysis configuration: {}", config);
        return config;
    }

    private static double toDouble(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("expected a number, got: " + v);
    }

    private static int toInteger(Object v) {
        if (v instanceof Integer || v instanceof Long) {
            return Math.toIntExact(((Number) v).longValue());
        }
        throw new IllegalArgumentException("expected an integer, got: " + v);
    }

    private static long toLong(Object v) {
        if (v instanceof Integer || v instanceof Long) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger big) {
            return big.longValueExact();
        }
        throw new IllegalArgumentException("expected an integer, got: " + v);
    }

    private static boolean toBoolean(Object v) {
        if (v instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("expected true or false, got: " + v);
    }

    private static <E extends Enum<E>> E toEnum(Class<E> type, Object v) {
        String name = String.valueOf(v).trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown value '" + v + "', expected one of "
                    + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT));
        }
    }

    private static List<DetectorType> toDetectors(Object v) {
        List<?> names;
        if (v instanceof List<?> list) {
            names = list;
        } else if (v instanceof String s) {
            names = Arrays.stream(s.split(",")).map(String::trim).filter(x -> !x.isEmpty()).toList();
        } else {
            throw new IllegalArgumentException("expected a list of detector names, got: " + v);
        }
        return names.stream().map(n -> DetectorType.fromName(String.valueOf(n))).toList();
    }
}
