package cn.zcn.lockmanager;

import cn.zcn.lockmanager.dependency.DependencyProvider;
import cn.zcn.lockmanager.dependency.LocalCache;
import cn.zcn.lockmanager.dependency.TransactionalConnection;
import cn.zcn.lockmanager.exception.ConfigException;
import cn.zcn.lockmanager.exception.LockManagerNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LockManagerGroupTest {

    private static final String DOMAIN = "wiki";

    private DependencyProvider dependencyProvider;
    private TransactionalConnection connection;
    private LocalCache localCache;
    private Logger logger;

    private final Map<LockManagerKind, AtomicInteger> created = new EnumMap<>(LockManagerKind.class);
    private final Map<LockManagerKind, LockManagerSettings> lastSettings = new EnumMap<>(LockManagerKind.class);
    private Map<LockManagerKind, LockManagerFactory> factories;

    @BeforeEach
    void before() {
        connection = mock(TransactionalConnection.class);
        localCache = mock(LocalCache.class);
        logger = LoggerFactory.getLogger("LockManager");

        dependencyProvider = mock(DependencyProvider.class);
        when(dependencyProvider.getConnection(anyString())).thenReturn(connection);
        when(dependencyProvider.getLocalCache()).thenReturn(localCache);
        when(dependencyProvider.getLogger(anyString())).thenReturn(logger);

        factories = new EnumMap<>(LockManagerKind.class);
        for (LockManagerKind kind : LockManagerKind.values()) {
            created.put(kind, new AtomicInteger());
            factories.put(kind, settings -> {
                created.get(kind).incrementAndGet();
                lastSettings.put(kind, settings);
                return new NullLockManager(settings);
            });
        }
    }

    private static Map<String, Object> record(String name, String clazz, Object... settings) {
        Map<String, Object> record = new LinkedHashMap<>();
        if (name != null) {
            record.put("name", name);
        }
        if (clazz != null) {
            record.put("class", clazz);
        }
        for (int i = 0; i < settings.length; i += 2) {
            record.put((String) settings[i], settings[i + 1]);
        }
        return record;
    }

    private LockManagerGroup newGroup(List<Map<String, Object>> configs) {
        return new LockManagerGroup(DOMAIN, configs, dependencyProvider, factories);
    }

    @Test
    void testDefaultAndFsRegistered() {
        LockManagerGroup group = newGroup(Arrays.asList(
                record("default", "DBLockManager"),
                record("fsLockManager", "FSLockManager", "lockDirectory", "/tmp/locks")));

        LockManager defaultManager = group.get("default");

        assertThat(group.getDefault()).isSameAs(defaultManager);
        assertThat(group.getAny()).isSameAs(defaultManager);
        assertThat(group.get("fsLockManager")).isNotNull().isNotSameAs(defaultManager);
        assertThatThrownBy(() -> group.get("nope"))
                .isInstanceOf(LockManagerNotFoundException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void testOnlyFsRegistered() throws InterruptedException {
        LockManagerGroup group = newGroup(Collections.singletonList(record("fsLockManager", "FSLockManager")));

        LockManager fallback = group.getDefault();
        assertThat(fallback).isInstanceOf(NullLockManager.class);
        assertThat(fallback.lock(Collections.singletonList("mwstore://a/b"), LockType.EXCLUSIVE, 0, TimeUnit.SECONDS)).isTrue();
        assertThat(created.get(LockManagerKind.FS)).hasValue(0);

        assertThat(group.getAny()).isSameAs(group.get("fsLockManager"));
        assertThat(created.get(LockManagerKind.FS)).hasValue(1);
    }

    @Test
    void testNothingRegistered() {
        LockManagerGroup group = newGroup(Collections.emptyList());

        assertThat(group.getDefault()).isInstanceOf(NullLockManager.class);
        assertThatThrownBy(group::getAny)
                .isInstanceOf(LockManagerNotFoundException.class)
                .hasMessageContaining("fsLockManager");
    }

    @Test
    void testGetReturnsSameInstance() {
        LockManagerGroup group = newGroup(Arrays.asList(
                record("a", "FSLockManager"),
                record("b", "RedisLockManager"),
                record("c", "NullLockManager")));

        for (String name : group.getNames()) {
            LockManager first = group.get(name);
            assertThat(group.get(name)).isSameAs(first);
            assertThat(group.get(name)).isSameAs(first);
        }

        assertThat(created.get(LockManagerKind.FS)).hasValue(1);
        assertThat(created.get(LockManagerKind.REDIS)).hasValue(1);
        assertThat(created.get(LockManagerKind.NULL)).hasValue(1);
    }

    @Test
    void testNotFoundAfterOtherResolutions() {
        LockManagerGroup group = newGroup(Collections.singletonList(record("default", "FSLockManager")));
        group.get("default");

        assertThatThrownBy(() -> group.get("other")).isInstanceOf(LockManagerNotFoundException.class);
        assertThatThrownBy(() -> group.config("other")).isInstanceOf(LockManagerNotFoundException.class);
    }

    @Test
    void testMissingName() {
        List<Map<String, Object>> configs = Arrays.asList(
                record("fsLockManager", "FSLockManager"),
                record(null, "DBLockManager"));

        assertThatThrownBy(() -> newGroup(configs))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("no name");
    }

    @Test
    void testMissingClass() {
        List<Map<String, Object>> configs = Arrays.asList(
                record("fsLockManager", "FSLockManager"),
                record("broken", null));

        assertThatThrownBy(() -> newGroup(configs))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void testUnknownClass() {
        assertThatThrownBy(() -> newGroup(Collections.singletonList(record("x", "MemcLockManager"))))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("MemcLockManager");
    }

    @Test
    void testImplementationKindKey() {
        Map<String, Object> record = record("default", null, "implementationKind", "redis");

        LockManagerGroup group = newGroup(Collections.singletonList(record));
        group.get("default");

        assertThat(created.get(LockManagerKind.REDIS)).hasValue(1);
        assertThat(group.config("default")).containsEntry("class", "redis").doesNotContainKey("implementationKind");
    }

    @Test
    void testDuplicateNameLastWins() {
        LockManagerGroup group = newGroup(Arrays.asList(
                record("default", "DBLockManager"),
                record("default", "FSLockManager", "lockDirectory", "/tmp/locks")));

        assertThat(group.getNames()).containsExactly("default");
        assertThat(group.config("default")).containsEntry("class", "FSLockManager");

        group.get("default");
        assertThat(created.get(LockManagerKind.FS)).hasValue(1);
        assertThat(created.get(LockManagerKind.DB)).hasValue(0);
    }

    @Test
    void testConstructionIsLazy() {
        LockManagerGroup group = newGroup(Arrays.asList(
                record("default", "DBLockManager"),
                record("fsLockManager", "FSLockManager")));

        group.config("default");
        group.config("fsLockManager");

        for (AtomicInteger count : created.values()) {
            assertThat(count).hasValue(0);
        }
        verify(dependencyProvider, never()).getConnection(anyString());
        verify(dependencyProvider, never()).getLocalCache();
    }

    @Test
    void testConfig() {
        Map<String, Object> servers = new HashMap<>();
        servers.put("srv1", "10.0.0.1:6379");

        LockManagerGroup group = newGroup(Collections.singletonList(
                record("redisLockManager", "RedisLockManager", "lockServers", servers, "lockTTL", 10)));

        Map<String, Object> config = group.config("redisLockManager");
        assertThat(config)
                .containsEntry("class", "RedisLockManager")
                .containsEntry("name", "redisLockManager")
                .containsEntry("domain", DOMAIN)
                .containsEntry("lockServers", servers)
                .containsEntry("lockTTL", 10);
        assertThatThrownBy(() -> config.put("lockTTL", 20)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testDatabaseDependenciesInjected() {
        Map<String, Object> dbServers = new HashMap<>();
        dbServers.put("replica", "db2");

        LockManagerGroup group = newGroup(Arrays.asList(
                record("default", "DBLockManager", "dbServers", dbServers),
                record("fsLockManager", "FSLockManager")));

        group.get("default");
        LockManagerSettings db = lastSettings.get(LockManagerKind.DB);
        assertThat(db.getDomain()).isEqualTo(DOMAIN);
        assertThat(db.getLocalDbMaster()).isSameAs(connection);
        assertThat(db.getMap(LockManagerSettings.DB_SERVERS)).containsEntry("replica", "db2");
        assertThat(db.getSrvCache()).isSameAs(localCache);
        assertThat(db.getLogger()).isSameAs(logger);
        assertThat(db.contains("class")).isFalse();
        verify(dependencyProvider).getConnection(DOMAIN);

        group.get("fsLockManager");
        LockManagerSettings fs = lastSettings.get(LockManagerKind.FS);
        assertThat(fs.getLocalDbMaster()).isNull();
        assertThat(fs.getSrvCache()).isNull();
        assertThat(fs.getLogger()).isSameAs(logger);
        assertThat(fs.getDomain()).isEqualTo(DOMAIN);
    }

    @Test
    void testFailedConstructionIsRetried() {
        AtomicInteger attempts = new AtomicInteger();
        factories.put(LockManagerKind.FS, settings -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ConfigException("Missing required setting `lockDirectory`.");
            }
            return new NullLockManager(settings);
        });

        LockManagerGroup group = newGroup(Collections.singletonList(record("fsLockManager", "FSLockManager")));

        assertThatThrownBy(() -> group.get("fsLockManager"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("lockDirectory");

        LockManager manager = group.get("fsLockManager");
        assertThat(manager).isNotNull();
        assertThat(group.get("fsLockManager")).isSameAs(manager);
        assertThat(attempts).hasValue(2);
    }

    @Test
    void testFactoryErrorPropagatesUnchanged() {
        IllegalStateException failure = new IllegalStateException("unreachable");
        factories.put(LockManagerKind.REDIS, settings -> {
            throw failure;
        });

        LockManagerGroup group = newGroup(Collections.singletonList(record("default", "RedisLockManager")));

        assertThatThrownBy(group::getDefault).isSameAs(failure);
    }

    @Test
    void testConcurrentGetCreatesOnce() throws Exception {
        int threadNum = 16;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger constructions = new AtomicInteger();

        factories.put(LockManagerKind.DB, settings -> {
            constructions.incrementAndGet();
            try {
                TimeUnit.MILLISECONDS.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new NullLockManager(settings);
        });

        LockManagerGroup group = newGroup(Collections.singletonList(record("default", "DBLockManager")));

        ExecutorService service = Executors.newFixedThreadPool(threadNum);
        List<Future<LockManager>> futures = new ArrayList<>();
        for (int i = 0; i < threadNum; i++) {
            futures.add(service.submit(() -> {
                start.await();
                return group.get("default");
            }));
        }
        start.countDown();

        LockManager first = futures.get(0).get(5, TimeUnit.SECONDS);
        for (Future<LockManager> f : futures) {
            assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
        }
        service.shutdown();

        assertThat(constructions).hasValue(1);
        verify(dependencyProvider).getConnection(DOMAIN);
    }

    @Test
    void testDefaultFactories() {
        LockManagerGroup group = new LockManagerGroup(DOMAIN,
                Collections.singletonList(record("nullLockManager", "NullLockManager")), dependencyProvider);

        assertThat(group.get("nullLockManager")).isInstanceOf(NullLockManager.class);
        assertThat(group.getDomain()).isEqualTo(DOMAIN);
    }
}
