package cn.zcn.lockmanager;

import cn.zcn.lockmanager.exception.ConfigException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个具名锁管理器的配置，构造后不可变
 */
public class LockManagerConfig {

    public static final String NAME = "name";
    public static final String CLASS = "class";
    public static final String IMPLEMENTATION_KIND = "implementationKind";
    public static final String DOMAIN = "domain";

    private final String name;
    private final String selector;
    private final LockManagerKind kind;
    private final String domain;

    /**
     * 除 class 之外的全部配置项，包含 name 和 domain
     */
    private final Map<String, Object> settings;

    private LockManagerConfig(Builder builder) {
        this.name = builder.name;
        this.selector = builder.selector;
        this.kind = builder.kind;
        this.domain = builder.domain;

        Map<String, Object> copy = new LinkedHashMap<>(builder.settings);
        copy.put(NAME, name);
        copy.put(DOMAIN, domain);
        this.settings = Collections.unmodifiableMap(copy);
    }

    /**
     * 从原始配置记录解析。记录必须包含 {@code name} 和 {@code class}（或 {@code implementationKind}）。
     *
     * @param domain 所属域
     * @param record 原始配置记录，不会被修改
     * @return 配置
     * @throws ConfigException 缺少 name、缺少实现类型或实现类型未知
     */
    public static LockManagerConfig fromRecord(String domain, Map<String, ?> record) {
        Object rawName = record.get(NAME);
        String name = rawName == null ? "" : String.valueOf(rawName);
        if (name.isEmpty()) {
            throw new ConfigException("Cannot register a lock manager with no name.");
        }

        String selectorKey = record.containsKey(CLASS) ? CLASS : IMPLEMENTATION_KIND;
        Object selector = record.get(selectorKey);
        if (!(selector instanceof String) || ((String) selector).isEmpty()) {
            throw new ConfigException("Cannot register lock manager `" + name + "` with no class.");
        }

        Builder builder = new Builder()
                .name(name)
                .selector((String) selector)
                .domain(domain);

        for (Map.Entry<String, ?> e : record.entrySet()) {
            String key = e.getKey();
            if (!CLASS.equals(key) && !IMPLEMENTATION_KIND.equals(key) && !NAME.equals(key) && !DOMAIN.equals(key)) {
                builder.setting(key, e.getValue());
            }
        }

        return builder.build();
    }

    public String getName() {
        return name;
    }

    /**
     * @return 配置中书写的实现类型，例如 {@code DBLockManager}
     */
    public String getSelector() {
        return selector;
    }

    public LockManagerKind getKind() {
        return kind;
    }

    public String getDomain() {
        return domain;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    /**
     * @return {@code class} 与其余配置项合并后的只读视图
     */
    public Map<String, Object> asMap() {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put(CLASS, selector);
        merged.putAll(settings);
        return Collections.unmodifiableMap(merged);
    }

    public static class Builder {
        private String name;
        private String selector;
        private LockManagerKind kind;
        private String domain;
        private final Map<String, Object> settings = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder selector(String selector) {
            this.selector = selector;
            return this;
        }

        public Builder kind(LockManagerKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder setting(String key, Object value) {
            this.settings.put(key, value);
            return this;
        }

        public LockManagerConfig build() {
            if (name == null || name.isEmpty()) {
                throw new ConfigException("Cannot register a lock manager with no name.");
            }

            if (kind == null) {
                if (selector == null || selector.isEmpty()) {
                    throw new ConfigException("Cannot register lock manager `" + name + "` with no class.");
                }
                kind = LockManagerKind.fromSelector(selector).orElseThrow(() ->
                        new ConfigException("Cannot register lock manager `" + name + "` with unknown class `" + selector + "`."));
            } else if (selector == null) {
                selector = kind.getAliases().get(0);
            }

            return new LockManagerConfig(this);
        }
    }
}
