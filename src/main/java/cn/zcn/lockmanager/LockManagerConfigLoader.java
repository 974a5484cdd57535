package cn.zcn.lockmanager;

import cn.zcn.lockmanager.exception.ConfigException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从 YAML 读取锁管理器配置，格式如下：
 * <pre>
 * lockManagers:
 *   - name: fsLockManager
 *     class: FSLockManager
 *     lockDirectory: /var/lock/files
 * </pre>
 */
public final class LockManagerConfigLoader {

    public static final String ROOT_KEY = "lockManagers";

    private LockManagerConfigLoader() {
    }

    /**
     * @param in YAML 输入流，由调用方关闭
     * @return 原始配置记录，顺序与文件一致
     * @throws ConfigException YAML 格式错误或结构不符
     */
    public static List<Map<String, Object>> load(InputStream in) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed lock manager configuration.", e);
        }

        if (document == null) {
            return new ArrayList<>();
        }
        if (!(document instanceof Map)) {
            throw new ConfigException("Lock manager configuration must be a map with key `" + ROOT_KEY + "`.");
        }

        Object managers = ((Map<?, ?>) document).get(ROOT_KEY);
        if (managers == null) {
            return new ArrayList<>();
        }
        if (!(managers instanceof List)) {
            throw new ConfigException("`" + ROOT_KEY + "` must be a list.");
        }

        List<Map<String, Object>> records = new ArrayList<>();
        for (Object item : (List<?>) managers) {
            if (!(item instanceof Map)) {
                throw new ConfigException("Each entry of `" + ROOT_KEY + "` must be a map.");
            }

            Map<String, Object> record = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) item).entrySet()) {
                record.put(String.valueOf(e.getKey()), e.getValue());
            }
            records.add(record);
        }

        return records;
    }
}
