package org.flagenums.core;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.flagenums.exception.InvalidException;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

import static org.flagenums.core.Constants.NON_UNCHECKED;
import static org.flagenums.core.Extends.as;

/**
 * Merged view of yaml files, later files overriding earlier ones. A file is read from the working directory if it
 * exists there, otherwise from every matching classpath resource.
 */
@Slf4j
@SuppressWarnings(NON_UNCHECKED)
public class YamlConfiguration {
    public static final YamlConfiguration RX_CONF = new YamlConfiguration(Constants.DEFAULT_CONFIG_FILES);

    public static Map<String, Object> loadYaml(String... fileNames) {
        Map<String, Object> result = new LinkedHashMap<>();
        Yaml yaml = new Yaml();
        for (String fileName : fileNames) {
            for (URL url : locate(fileName)) {
                try (InputStream in = url.openStream()) {
                    for (Object data : yaml.loadAll(in)) {
                        fill(as(data, Map.class), result);
                    }
                } catch (IOException e) {
                    throw new InvalidException("Load yaml {} error", url, e);
                }
            }
        }
        return result;
    }

    static List<URL> locate(String fileName) {
        try {
            File file = new File(fileName);
            if (file.exists()) {
                return Collections.singletonList(file.toURI().toURL());
            }
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            if (loader == null) {
                loader = YamlConfiguration.class.getClassLoader();
            }
            List<URL> urls = Collections.list(loader.getResources(fileName));
            //classpath order is highest priority first
            Collections.reverse(urls);
            return urls;
        } catch (IOException e) {
            throw InvalidException.sneaky(e);
        }
    }

    private static void fill(Map<String, Object> child, Map<String, Object> parent) {
        if (child == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : child.entrySet()) {
            Map<String, Object> next;
            if ((next = as(entry.getValue(), Map.class)) == null) {
                parent.put(entry.getKey(), entry.getValue());
                continue;
            }
            Map<String, Object> nextAll = (Map<String, Object>) parent.get(entry.getKey());
            if (nextAll == null) {
                parent.put(entry.getKey(), new LinkedHashMap<>(next));
                continue;
            }
            fill(next, nextAll);
        }
    }

    @Getter
    final Map<String, Object> yaml;

    public YamlConfiguration(@NonNull String... fileNames) {
        yaml = loadYaml(fileNames);
    }

    public YamlConfiguration(@NonNull Map<String, Object> yaml) {
        this.yaml = yaml;
    }

    /**
     * @param key dotted path, e.g. {@code app.flags.delimiter}
     */
    public <T> T read(@NonNull String key, T defaultVal) {
        Object v = yaml;
        for (String k : Strings.split(key, Constants.CONFIG_KEY_SPLITS)) {
            Map<String, Object> map = as(v, Map.class);
            if (map == null || (v = map.get(k)) == null) {
                return defaultVal;
            }
        }
        return (T) v;
    }
}
