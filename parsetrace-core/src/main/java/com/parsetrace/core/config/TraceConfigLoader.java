package com.parsetrace.core.config;

import com.parsetrace.api.exception.TraceConfigException;
import com.parsetrace.core.util.YamlUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 配置加载
 * 从 classpath 根目录的 parsetrace.yml 读取，文件不存在时使用默认配置。
 */
@Slf4j
public class TraceConfigLoader {

    public static final String CONFIG_FILE_NAME = "parsetrace.yml";

    private TraceConfigLoader() {
    }

    /**
     * 从当前线程的 ClassLoader 加载
     */
    public static TraceConfig load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = TraceConfigLoader.class.getClassLoader();
        }
        return loadFromClasspath(cl, CONFIG_FILE_NAME);
    }

    public static TraceConfig loadFromClasspath(ClassLoader classLoader, String resourceName) {
        InputStream is = classLoader.getResourceAsStream(resourceName);
        if (is == null) {
            log.debug("No {} found on classpath, using default trace config", resourceName);
            return TraceConfig.defaults();
        }
        TraceConfig config = load(is, "classpath:" + resourceName);
        log.info("Loaded trace config from classpath:{} -> {}", resourceName, config);
        return config;
    }

    public static TraceConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new TraceConfigException("Trace config file not found: " + file);
        }
        try {
            TraceConfig config = load(Files.newInputStream(file), file.toString());
            log.info("Loaded trace config from {} -> {}", file, config);
            return config;
        } catch (IOException e) {
            throw new TraceConfigException("Failed to read trace config: " + file, e);
        }
    }

    static TraceConfig load(InputStream inputStream, String source) {
        Yaml yaml = YamlUtils.createLoaderYaml();

        try (InputStream is = inputStream) {
            TraceSettings settings = yaml.loadAs(is, TraceSettings.class);
            if (settings == null) {
                // 空文件
                return TraceConfig.defaults();
            }
            settings.validate();
            return settings.toConfig();
        } catch (YAMLException e) {
            throw new TraceConfigException("Malformed trace config " + source + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TraceConfigException("Failed to read trace config " + source, e);
        }
    }
}
