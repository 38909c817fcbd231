package io.fullerstack.strands.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Optional;
import java.util.ResourceBundle;
import java.util.function.Function;

/**
 * Layered settings for the runtime, backed by {@link ResourceBundle}.
 *
 * <p>Lookup order for every key:
 * <ol>
 *   <li>system property of the same name</li>
 *   <li>strands_{component}.properties, when built with {@link #forComponent(String)}</li>
 *   <li>strands.properties</li>
 * </ol>
 *
 * <p>The component name travels as the bundle locale's language, so
 * {@code forComponent("ingest")} reads {@code strands_ingest.properties} and
 * inherits every key it leaves out from {@code strands.properties}.
 *
 * <pre>
 * # strands.properties
 * scheduler.worker-count=0
 *
 * # strands_ingest.properties
 * scheduler.worker-count=8
 * </pre>
 *
 * <p>A default only stands in for an absent key. A present value that does not
 * parse is always a {@link ConfigurationException}.
 */
public class HierarchicalConfig {

  private static final String BUNDLE = "strands";

  private final ResourceBundle bundle;
  private final String context;

  private HierarchicalConfig(ResourceBundle bundle, String context) {
    this.bundle = bundle;
    this.context = context;
  }

  /**
   * Settings from strands.properties alone.
   */
  public static HierarchicalConfig global() {
    return new HierarchicalConfig(ResourceBundle.getBundle(BUNDLE, Locale.ROOT), "global");
  }

  /**
   * Settings for one named component, falling back to the global file.
   *
   * @param component component name, e.g. "ingest"
   */
  public static HierarchicalConfig forComponent(String component) {
    Objects.requireNonNull(component, "component cannot be null");
    if (component.isBlank()) {
      throw new IllegalArgumentException("component cannot be blank");
    }
    Locale locale = new Locale(component.toLowerCase(Locale.ROOT));
    return new HierarchicalConfig(ResourceBundle.getBundle(BUNDLE, locale), "component:" + component);
  }

  // =========================================================================
  // Getters
  // =========================================================================

  /**
   * @throws ConfigurationException if the key is absent at every level
   */
  public String getString(String key) {
    return lookup(key).orElseThrow(() -> new ConfigurationException(
      "Missing config key '" + key + "' in context: " + context
    ));
  }

  public String getString(String key, String defaultValue) {
    return lookup(key).orElse(defaultValue);
  }

  /**
   * @throws ConfigurationException if the key is absent or not an int
   */
  public int getInt(String key) {
    return parse(key, getString(key), "int", Integer::parseInt);
  }

  /**
   * @throws ConfigurationException if the key is present but not an int
   */
  public int getInt(String key, int defaultValue) {
    return lookup(key)
      .map(value -> parse(key, value, "int", Integer::parseInt))
      .orElse(defaultValue);
  }

  /**
   * @throws ConfigurationException if the key is present but not a long
   */
  public long getLong(String key, long defaultValue) {
    return lookup(key)
      .map(value -> parse(key, value, "long", Long::parseLong))
      .orElse(defaultValue);
  }

  /**
   * Accepts {@code true} or {@code false}, ignoring case.
   *
   * @throws ConfigurationException if the key is present but holds anything else
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    return lookup(key)
      .map(value -> parse(key, value, "boolean", HierarchicalConfig::parseBoolean))
      .orElse(defaultValue);
  }

  /**
   * Enum constant by case-insensitive name.
   *
   * @throws ConfigurationException if the key is present but names no constant of {@code type}
   */
  public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
    return lookup(key)
      .map(value -> parse(key, value, type.getSimpleName(),
        name -> Enum.valueOf(type, name.toUpperCase(Locale.ROOT))))
      .orElse(defaultValue);
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }

  // =========================================================================
  // Internals
  // =========================================================================

  private Optional<String> lookup(String key) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return Optional.of(sysProp);
    }
    try {
      return Optional.of(bundle.getString(key));
    } catch (MissingResourceException e) {
      return Optional.empty();
    }
  }

  private <V> V parse(String key, String value, String typeName, Function<String, V> parser) {
    try {
      return parser.apply(value.trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
        "Invalid " + typeName + " value for key '" + key + "' in context " + context + ": " + value, e
      );
    }
  }

  private static boolean parseBoolean(String value) {
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("not a boolean: " + value);
  }
}
