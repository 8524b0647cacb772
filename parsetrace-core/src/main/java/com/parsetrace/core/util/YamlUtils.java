package com.parsetrace.core.util;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * YAML 工具类
 * SnakeYAML 2.x 默认禁止 !! 全局标签，这里只放行 com.parsetrace.* 下的类型。
 */
public final class YamlUtils {

    private static final String ALLOWED_TAG_PREFIX = "com.parsetrace.";

    private YamlUtils() {
    }

    /**
     * 创建仅用于加载的 Yaml 实例
     */
    public static Yaml createLoaderYaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);
        loaderOptions.setTagInspector(tag -> {
            String className = tag.getClassName();
            return className != null && className.startsWith(ALLOWED_TAG_PREFIX);
        });
        return new Yaml(new Constructor(loaderOptions));
    }
}
