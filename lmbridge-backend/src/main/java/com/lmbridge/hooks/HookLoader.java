package com.lmbridge.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads operator-supplied plugin classes (db hooks, payload transforms).
 *
 * <p>A plugin is declared by a class name, a jar location, or both:
 * <ul>
 *   <li>class name only: loaded from the application class path;</li>
 *   <li>location only: the jar (or every jar in the directory) is put on an isolated
 *   {@link URLClassLoader} and the first implementation registered under
 *   {@code META-INF/services/<type>} is used;</li>
 *   <li>both: the named class is loaded from the jar.</li>
 * </ul>
 *
 * Failures are logged and reported as an empty result; they never propagate.
 */
@Component
public class HookLoader {

    private static final Logger log = LoggerFactory.getLogger(HookLoader.class);

    /**
     * Load and instantiate a plugin.
     *
     * @param type plugin interface
     * @param className fully-qualified implementation class, may be null
     * @param location jar file or directory of jars, may be null
     * @param label log label, e.g. "DB hooks"
     * @param <T> plugin type
     * @return plugin instance, or empty when nothing is declared or loading failed
     */
    public <T> Optional<T> load(Class<T> type, String className, String location, String label) {
        boolean hasClass = className != null && !className.isBlank();
        boolean hasLocation = location != null && !location.isBlank();
        if (!hasClass && !hasLocation) {
            return Optional.empty();
        }

        if (!hasLocation) {
            return instantiate(type, className.trim(), HookLoader.class.getClassLoader(), label);
        }

        URLClassLoader loader;
        try {
            loader = openLocation(Paths.get(location.trim()));
        } catch (Exception e) {
            log.error("LM-Bridge {}: cannot load hook file {}", label, location, e);
            return Optional.empty();
        }

        Optional<T> loaded = hasClass
                ? instantiate(type, className.trim(), loader, label)
                : discover(type, loader, location, label);
        if (loaded.isEmpty()) {
            close(loader, location, label);
        }
        return loaded;
    }

    private void close(URLClassLoader loader, String location, String label) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("LM-Bridge {}: failed to release hook file {}", label, location, e);
        }
    }

    private URLClassLoader openLocation(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Hook location does not exist: " + path);
        }

        List<Path> jars;
        if (Files.isDirectory(path)) {
            try (Stream<Path> stream = Files.walk(path, 2)) {
                jars = stream
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName() != null)
                        .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar"))
                        .sorted()
                        .collect(Collectors.toList());
            }
            if (jars.isEmpty()) {
                throw new IOException("No jar files found under: " + path);
            }
        } else {
            jars = List.of(path);
        }

        List<URL> urls = new ArrayList<>();
        for (Path jar : jars) {
            urls.add(jar.toUri().toURL());
        }
        return new URLClassLoader(urls.toArray(new URL[0]), HookLoader.class.getClassLoader());
    }

    private <T> Optional<T> instantiate(Class<T> type, String className, ClassLoader loader, String label) {
        try {
            Class<?> clazz = Class.forName(className, true, loader);
            if (!type.isAssignableFrom(clazz)) {
                log.error("LM-Bridge {}: {} does not implement {}", label, className, type.getName());
                return Optional.empty();
            }
            Object obj = clazz.getDeclaredConstructor().newInstance();
            log.info("LM-Bridge {}: loaded {}", label, className);
            return Optional.of(type.cast(obj));
        } catch (Exception | LinkageError e) {
            log.error("LM-Bridge {}: failed to load class {}", label, className, e);
            return Optional.empty();
        }
    }

    private <T> Optional<T> discover(Class<T> type, ClassLoader loader, String location, String label) {
        try {
            Iterator<T> it = ServiceLoader.load(type, loader).iterator();
            if (it.hasNext()) {
                T found = it.next();
                log.info("LM-Bridge {}: loaded {} from {}", label, found.getClass().getName(), location);
                return Optional.of(found);
            }
        } catch (Exception | ServiceConfigurationError e) {
            log.error("LM-Bridge {}: failed to load hook file {}", label, location, e);
            return Optional.empty();
        }
        log.error("LM-Bridge {}: hook file {} registers no {} under META-INF/services", label, location, type.getName());
        return Optional.empty();
    }
}
