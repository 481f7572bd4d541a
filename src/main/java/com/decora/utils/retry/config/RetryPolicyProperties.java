package com.decora.utils.retry.config;

import com.decora.utils.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Reads a {@link RetryPolicy} from {@link Properties}.
 * <p>
 * Recognised keys, each under an optional prefix such as {@code "http.retry."}:
 * {@code max-attempts}, {@code initial-delay}, {@code backoff-multiplier}, {@code max-delay},
 * {@code jitter} and {@code retry-on}. Durations are ISO-8601 ({@code PT0.5S}) or plain
 * milliseconds. {@code retry-on} is a comma separated list of exception class names. Keys that
 * are absent keep the defaults of {@link RetryPolicy#DEFAULT}.
 * <p>
 * A listener cannot be configured this way; add one on the returned builder.
 */
@Slf4j
public final class RetryPolicyProperties {
    public static final String MAX_ATTEMPTS = "max-attempts";
    public static final String INITIAL_DELAY = "initial-delay";
    public static final String BACKOFF_MULTIPLIER = "backoff-multiplier";
    public static final String MAX_DELAY = "max-delay";
    public static final String JITTER = "jitter";
    public static final String RETRY_ON = "retry-on";

    private RetryPolicyProperties() {}

    public static RetryPolicy.Builder load(Properties properties, String prefix) {
        Validate.notNull(properties, "Properties cannot be null");
        String p = StringUtils.defaultString(prefix);
        RetryPolicy.Builder builder = RetryPolicy.builder();

        String value;
        if ((value = read(properties, p, MAX_ATTEMPTS)) != null) {
            int maxAttempts = parseInt(p + MAX_ATTEMPTS, value);
            builder = apply(builder, p + MAX_ATTEMPTS, value, b -> b.maxAttempts(maxAttempts));
        }
        if ((value = read(properties, p, INITIAL_DELAY)) != null) {
            Duration initialDelay = parseDuration(p + INITIAL_DELAY, value);
            builder = apply(builder, p + INITIAL_DELAY, value, b -> b.initialDelay(initialDelay));
        }
        if ((value = read(properties, p, BACKOFF_MULTIPLIER)) != null) {
            double multiplier = parseDouble(p + BACKOFF_MULTIPLIER, value);
            builder = apply(builder, p + BACKOFF_MULTIPLIER, value, b -> b.backoffMultiplier(multiplier));
        }
        if ((value = read(properties, p, MAX_DELAY)) != null) {
            Duration maxDelay = parseDuration(p + MAX_DELAY, value);
            builder = apply(builder, p + MAX_DELAY, value, b -> b.maxDelay(maxDelay));
        }
        if ((value = read(properties, p, JITTER)) != null) {
            Duration jitter = parseDuration(p + JITTER, value);
            builder = apply(builder, p + JITTER, value, b -> b.jitter(jitter));
        }
        if ((value = read(properties, p, RETRY_ON)) != null)
            builder = builder.retryOn(parseTypes(p + RETRY_ON, value));

        log.debug("Loaded retry policy with prefix '{}': {}", p, builder.build());
        return builder;
    }

    public static RetryPolicy.Builder load(InputStream in, String prefix) {
        Validate.notNull(in, "Input stream cannot be null");
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read retry properties", e);
        }
        return load(properties, prefix);
    }

    public static RetryPolicy.Builder loadResource(String resource, String prefix) {
        Validate.notBlank(resource, "Resource name cannot be blank");
        InputStream in = RetryPolicyProperties.class.getClassLoader().getResourceAsStream(resource);
        Validate.isTrue(in != null, "Resource %s was not found on the classpath", resource);
        return load(in, prefix);
    }

    private static RetryPolicy.Builder apply(RetryPolicy.Builder builder, String key, String value,
                                             UnaryOperator<RetryPolicy.Builder> setter) {
        try {
            return setter.apply(builder);
        } catch (IllegalArgumentException e) {
            throw invalid(key, value, e);
        }
    }

    private static String read(Properties properties, String prefix, String key) {
        return StringUtils.trimToNull(properties.getProperty(prefix + key));
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw invalid(key, value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw invalid(key, value, e);
        }
    }

    static Duration parseDuration(String key, String value) {
        try {
            if (StringUtils.isNumeric(value))
                return Duration.ofMillis(Long.parseLong(value));
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw invalid(key, value, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable>[] parseTypes(String key, String value) {
        List<Class<? extends Throwable>> types = new ArrayList<>();
        for (String name : StringUtils.split(value, ',')) {
            String className = name.trim();
            if (className.isEmpty())
                continue;
            Class<?> type;
            try {
                type = ClassUtils.getClass(className);
            } catch (ClassNotFoundException e) {
                throw invalid(key, className, e);
            }
            if (!Throwable.class.isAssignableFrom(type))
                throw new IllegalArgumentException("Property " + key + " names " + className + ", which is not a Throwable");
            types.add(type.asSubclass(Throwable.class));
        }
        Validate.isTrue(!types.isEmpty(), "Property %s lists no exception types", key);
        return types.toArray(new Class[0]);
    }

    private static IllegalArgumentException invalid(String key, String value, Exception cause) {
        return new IllegalArgumentException("Invalid value '" + value + "' for property " + key, cause);
    }
}
