package com.clawweb.core.util;

import com.clawweb.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * YAML 설정 파일(-c/--config)을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com/"
 * maxDepth: 30
 * sameHostOnly: true
 * confinePrefix: "https://example.com/docs/"
 * excludePrefixes: ["https://example.com/private/"]   # 또는 "a,b,c"
 * reportFiltering: true
 * timeoutMs: 30000
 * followRedirects: true
 * userAgent: "ClawWeb/0.1 (+crawler)"
 *
 * 모르는 키는 무시, 없는 키는 기본값 유지.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** target 은 CLI 에서 채울 수 있으므로 여기서는 validate() 하지 않는다. */
    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root;
            try {
                root = yaml.load(in);
            } catch (YAMLException e) {
                throw new IOException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
            }
            return fromMap(root);
        }
    }

    static CrawlConfig fromMap(Object root) throws IOException {
        CrawlConfig cfg = CrawlConfig.defaults();
        // 비어있거나 단순 스칼라면 defaults 유지
        if (!(root instanceof Map<?, ?> map)) return cfg;

        try {
            setString(map, "target", cfg::setTarget);
            setInt(map, "maxDepth", cfg::setMaxDepth);
            setBoolean(map, "sameHostOnly", cfg::setSameHostOnly);
            setString(map, "confinePrefix", cfg::setConfinePrefix);
            setStringList(map, "excludePrefixes", cfg::setExcludePrefixes);
            setBoolean(map, "reportFiltering", cfg::setReportFiltering);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);
            setString(map, "userAgent", cfg::setUserAgent);
        } catch (NumberFormatException e) {
            throw new IOException("invalid number in config: " + e.getMessage(), e);
        }
        return cfg;
    }

    // ------------ helpers ------------
    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
                if (!p.isEmpty()) out.add(p);
            }
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
