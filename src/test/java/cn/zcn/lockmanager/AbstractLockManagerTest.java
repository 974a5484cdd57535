package cn.zcn.lockmanager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class AbstractLockManagerTest {

    private static class RecordingLockManager extends AbstractLockManager {
        private final List<String> calls = new ArrayList<>();
        private final Set<String> busy = new HashSet<>();
        private int failuresLeft;

        private RecordingLockManager() {
            super(LockManagerSettings.builder(LockManagerKind.NULL).build());
        }

        @Override
        protected boolean doLock(List<String> paths, LockType type) {
            calls.add("lock " + type + " " + paths);
            if (failuresLeft > 0) {
                failuresLeft--;
                return false;
            }
            for (String path : paths) {
                if (busy.contains(path)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        protected boolean doUnlock(List<String> paths, LockType type) {
            calls.add("unlock " + type + " " + paths);
            return true;
        }
    }

    private RecordingLockManager manager;

    @BeforeEach
    void before() {
        manager = new RecordingLockManager();
    }

    @Test
    void testReentrantLock() throws InterruptedException {
        List<String> paths = Collections.singletonList("a");

        assertThat(manager.lock(paths, LockType.EXCLUSIVE, 0, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.lock(paths, LockType.EXCLUSIVE, 0, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]");

        assertThat(manager.unlock(paths, LockType.EXCLUSIVE)).isTrue();
        assertThat(manager.isHeld("a", LockType.EXCLUSIVE)).isTrue();
        assertThat(manager.calls).hasSize(1);

        assertThat(manager.unlock(paths, LockType.EXCLUSIVE)).isTrue();
        assertThat(manager.isHeld("a", LockType.EXCLUSIVE)).isFalse();
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]", "unlock EXCLUSIVE [a]");
    }

    @Test
    void testExclusiveCoversShared() throws InterruptedException {
        manager.lock(Collections.singletonList("a"), LockType.EXCLUSIVE, 0, TimeUnit.SECONDS);

        assertThat(manager.lock(Arrays.asList("a", "b"), LockType.SHARED, 0, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]", "lock SHARED [b]");

        manager.unlock(Arrays.asList("a", "b"), LockType.SHARED);
        assertThat(manager.calls).endsWith("unlock SHARED [b]");
        assertThat(manager.isHeld("a", LockType.SHARED)).isTrue();
    }

    @Test
    void testExclusiveReleasedBeforeCoveredShared() throws InterruptedException {
        List<String> paths = Collections.singletonList("a");

        manager.lock(paths, LockType.EXCLUSIVE, 0, TimeUnit.SECONDS);
        manager.lock(paths, LockType.SHARED, 0, TimeUnit.SECONDS);

        assertThat(manager.unlock(paths, LockType.EXCLUSIVE)).isTrue();
        assertThat(manager.isHeld("a", LockType.SHARED)).isTrue();
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]");

        assertThat(manager.unlock(paths, LockType.SHARED)).isTrue();
        assertThat(manager.isHeld("a", LockType.SHARED)).isFalse();
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]", "unlock EXCLUSIVE [a]");
    }

    @Test
    void testExclusiveRelockWhileSharedKeepsBackendLock() throws InterruptedException {
        List<String> paths = Collections.singletonList("a");

        manager.lock(paths, LockType.EXCLUSIVE, 0, TimeUnit.SECONDS);
        manager.lock(paths, LockType.SHARED, 0, TimeUnit.SECONDS);
        manager.unlock(paths, LockType.EXCLUSIVE);

        assertThat(manager.lock(paths, LockType.EXCLUSIVE, 0, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]");

        manager.unlock(paths, LockType.SHARED);
        assertThat(manager.isHeld("a", LockType.EXCLUSIVE)).isTrue();
        assertThat(manager.calls).hasSize(1);

        manager.unlock(paths, LockType.EXCLUSIVE);
        assertThat(manager.calls).containsExactly("lock EXCLUSIVE [a]", "unlock EXCLUSIVE [a]");
    }

    @Test
    void testDuplicatePaths() throws InterruptedException {
        assertThat(manager.lock(Arrays.asList("a", "a", "b"), LockType.SHARED, 0, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.calls).containsExactly("lock SHARED [a, b]");

        assertThat(manager.unlock(Arrays.asList("a", "b"), LockType.SHARED)).isTrue();
        assertThat(manager.isHeld("a", LockType.SHARED)).isFalse();
    }

    @Test
    void testUnlockNotHeld() throws InterruptedException {
        manager.lock(Collections.singletonList("a"), LockType.SHARED, 0, TimeUnit.SECONDS);

        assertThat(manager.unlock(Arrays.asList("a", "b"), LockType.SHARED)).isFalse();
        assertThat(manager.unlock(Collections.singletonList("a"), LockType.EXCLUSIVE)).isFalse();
        assertThat(manager.isHeld("a", LockType.SHARED)).isFalse();
    }

    @Test
    void testRetryUntilAcquired() throws InterruptedException {
        manager.failuresLeft = 2;

        assertThat(manager.lock(Collections.singletonList("a"), LockType.EXCLUSIVE, 3, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.calls).hasSize(3);
    }

    @Test
    void testTimeout() throws InterruptedException {
        manager.busy.add("b");

        long startTime = System.currentTimeMillis();
        assertThat(manager.lock(Arrays.asList("a", "b"), LockType.EXCLUSIVE, 200, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(System.currentTimeMillis() - startTime).isGreaterThanOrEqualTo(150);

        assertThat(manager.isHeld("a", LockType.EXCLUSIVE)).isFalse();
        assertThat(manager.calls.size()).isGreaterThan(1);
    }

    @Test
    void testNoWait() throws InterruptedException {
        manager.busy.add("a");

        assertThat(manager.lock(Collections.singletonList("a"), LockType.SHARED, 0, TimeUnit.SECONDS)).isFalse();
        assertThat(manager.calls).hasSize(1);
    }

    @Test
    void testLockByTypeRollsBack() throws InterruptedException {
        manager.busy.add("x");

        Map<LockType, List<String>> paths = new EnumMap<>(LockType.class);
        paths.put(LockType.SHARED, Collections.singletonList("a"));
        paths.put(LockType.EXCLUSIVE, Collections.singletonList("x"));

        assertThat(manager.lockByType(paths, 0, TimeUnit.SECONDS)).isFalse();
        assertThat(manager.isHeld("a", LockType.SHARED)).isFalse();
        assertThat(manager.calls).contains("unlock SHARED [a]");
    }

    @Test
    void testSha1Base36() {
        assertThat(AbstractLockManager.sha1Base36("mwstore://local-backend/a.png"))
                .matches("[0-9a-z]+")
                .isEqualTo(AbstractLockManager.sha1Base36("mwstore://local-backend/a.png"))
                .isNotEqualTo(AbstractLockManager.sha1Base36("mwstore://local-backend/b.png"));
    }
}
