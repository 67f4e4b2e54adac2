package ca.gc.cra.flowstart.infrastructure.json;

/**
 * Runtime check for the JSON serializer.
 * <p>Lets the output registry skip JSON modules instead of failing to link when the serializer is not on
 * the class path.</p>
 */
public final class JsonSupport {
  static final String GENERATOR_CLASS = "com.fasterxml.jackson.core.JsonFactory";

  private JsonSupport() {}

  /**
   * Checks whether the JSON serializer can be loaded.
   *
   * @return {@code true} when JSON output is available
   */
  public static boolean isAvailable() {
    return isLoadable(GENERATOR_CLASS, JsonSupport.class.getClassLoader());
  }

  static boolean isLoadable(String className, ClassLoader loader) {
    try {
      Class.forName(className, false, loader);
      return true;
    } catch (ClassNotFoundException | LinkageError ex) {
      return false;
    }
  }
}
