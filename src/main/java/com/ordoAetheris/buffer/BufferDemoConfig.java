package com.ordoAetheris.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Settings for {@link BufferDemo}.
 *
 * <p>Values come from {@code buffer-demo.properties} on the classpath. A JVM system property with
 * the same key wins over the file:
 * <pre>
 * java -Ddemo.producers=8 -cp ... com.ordoAetheris.buffer.BufferDemo
 * </pre>
 */
public final class BufferDemoConfig {

    private static final Logger logger = LoggerFactory.getLogger(BufferDemoConfig.class);

    static final String BUNDLE = "buffer-demo";

    private final int producers;
    private final int consumers;
    private final int perProducer;
    private final int batchSize;
    private final PushPopType pushType;
    private final PushPopType popType;
    private final int timeoutSeconds;
    private final int totalItems;

    public BufferDemoConfig(int producers, int consumers, int perProducer, int batchSize,
                            PushPopType pushType, PushPopType popType, int timeoutSeconds) {
        this.producers = positive("demo.producers", producers);
        this.consumers = positive("demo.consumers", consumers);
        this.perProducer = positive("demo.per-producer", perProducer);
        this.batchSize = positive("demo.batch-size", batchSize);
        if (pushType == null || popType == null) throw new IllegalArgumentException("push/pop type must not be null");
        this.pushType = pushType;
        this.popType = popType;
        this.timeoutSeconds = positive("demo.timeout-seconds", timeoutSeconds);
        try {
            this.totalItems = Math.multiplyExact(this.producers, this.perProducer);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("demo.producers * demo.per-producer overflows int: "
                    + producers + " * " + perProducer, e);
        }
    }

    public static BufferDemoConfig load() {
        return load(ResourceBundle.getBundle(BUNDLE, Locale.ROOT));
    }

    public static BufferDemoConfig load(ResourceBundle bundle) {
        BufferDemoConfig config = new BufferDemoConfig(
                getInt(bundle, "demo.producers"),
                getInt(bundle, "demo.consumers"),
                getInt(bundle, "demo.per-producer"),
                getInt(bundle, "demo.batch-size"),
                getType(bundle, "demo.push-type"),
                getType(bundle, "demo.pop-type"),
                getInt(bundle, "demo.timeout-seconds"));
        logger.debug("Loaded {}", config);
        return config;
    }

    static String getString(ResourceBundle bundle, String key) {
        String override = System.getProperty(key);
        if (override != null) return override.trim();
        try {
            return bundle.getString(key).trim();
        } catch (MissingResourceException e) {
            throw new IllegalStateException("Missing config key: " + key, e);
        }
    }

    static int getInt(ResourceBundle bundle, String key) {
        String value = getString(bundle, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key " + key + " is not an integer: " + value, e);
        }
    }

    static PushPopType getType(ResourceBundle bundle, String key) {
        String value = getString(bundle, key);
        try {
            return PushPopType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Config key " + key + " must be FRONT or REAR, was: " + value, e);
        }
    }

    private static int positive(String key, int value) {
        if (value <= 0) throw new IllegalArgumentException(key + " must be > 0, was " + value);
        return value;
    }

    public int producers() {
        return producers;
    }

    public int consumers() {
        return consumers;
    }

    public int perProducer() {
        return perProducer;
    }

    public int batchSize() {
        return batchSize;
    }

    public PushPopType pushType() {
        return pushType;
    }

    public PushPopType popType() {
        return popType;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public int totalItems() {
        return totalItems;
    }

    @Override
    public String toString() {
        return "BufferDemoConfig{producers=" + producers + ", consumers=" + consumers
                + ", perProducer=" + perProducer + ", batchSize=" + batchSize
                + ", push=" + pushType + ", pop=" + popType + ", timeoutSeconds=" + timeoutSeconds + "}";
    }
}
