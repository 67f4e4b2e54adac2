package ca.gc.cra.flowstart.config;

import java.io.IOException;
import java.io.InputStream;

/**
 * Class loader that defines the project's own classes itself and reports the Jackson classes as missing,
 * mimicking a deployment without the JSON serializer. Every other class comes from the parent.
 */
final class JacksonHidingClassLoader extends ClassLoader {
  private static final String HIDDEN_PREFIX = "com.fasterxml.jackson.";
  private static final String OWN_PREFIX = "ca.gc.cra.flowstart.";

  JacksonHidingClassLoader(ClassLoader parent) {
    super(parent);
  }

  @Override
  protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
    if (name.startsWith(HIDDEN_PREFIX)) {
      throw new ClassNotFoundException(name);
    }
    if (!name.startsWith(OWN_PREFIX)) {
      return super.loadClass(name, resolve);
    }
    synchronized (getClassLoadingLock(name)) {
      Class<?> loaded = findLoadedClass(name);
      if (loaded == null) {
        loaded = defineOwn(name);
      }
      if (resolve) {
        resolveClass(loaded);
      }
      return loaded;
    }
  }

  private Class<?> defineOwn(String name) throws ClassNotFoundException {
    String resource = name.replace('.', '/') + ".class";
    try (InputStream in = getParent().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ClassNotFoundException(name);
      }
      byte[] bytes = in.readAllBytes();
      return defineClass(name, bytes, 0, bytes.length);
    } catch (IOException ex) {
      throw new ClassNotFoundException(name, ex);
    }
  }
}
