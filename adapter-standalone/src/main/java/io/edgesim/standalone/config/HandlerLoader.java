package io.edgesim.standalone.config;

import io.edgesim.core.spi.StageHandler;
import java.lang.reflect.InvocationTargetException;
import java.util.HashMap;
import java.util.Map;

/**
 * Instantiates {@link StageHandler} implementations named in the
 * configuration by fully qualified class name.
 *
 * <p>
 * Each class needs a public no-arg constructor. A loader instantiates every
 * distinct class once, so behaviors naming the same class share one
 * instance. Not thread-safe; use one loader per registry build.
 */
public final class HandlerLoader {

    private final ClassLoader classLoader;
    private final Map<String, StageHandler> instances = new HashMap<>();

    public HandlerLoader() {
        this(HandlerLoader.class.getClassLoader());
    }

    public HandlerLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Returns the handler instance for {@code className}.
     *
     * @throws ConfigLoadException if the class is missing, is not a
     *                             {@code StageHandler}, or cannot be constructed
     */
    public StageHandler load(String className) {
        StageHandler existing = instances.get(className);
        if (existing != null) {
            return existing;
        }
        StageHandler handler = instantiate(className);
        instances.put(className, handler);
        return handler;
    }

    private StageHandler instantiate(String className) {
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ConfigLoadException("Handler class not found: " + className, e);
        }
        if (!StageHandler.class.isAssignableFrom(type)) {
            throw new ConfigLoadException(
                    "Handler class " + className + " does not implement " + StageHandler.class.getName());
        }
        try {
            return (StageHandler) type.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new ConfigLoadException("Handler class " + className + " has no public no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw new ConfigLoadException(
                    "Handler class " + className + " failed to initialize: " + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ConfigLoadException("Handler class " + className + " cannot be instantiated", e);
        }
    }
}
