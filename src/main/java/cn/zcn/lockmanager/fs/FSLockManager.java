package cn.zcn.lockmanager.fs;

import cn.zcn.lockmanager.AbstractLockManager;
import cn.zcn.lockmanager.LockManagerSettings;
import cn.zcn.lockmanager.LockType;
import cn.zcn.lockmanager.exception.ConfigException;
import cn.zcn.lockmanager.exception.LockException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于操作系统文件锁的锁管理器，适用于所有进程共享同一目录的场景。
 * <p>
 * 每个路径对应目录下的一个锁文件。进程之间依靠文件锁互斥；同一 JVM 内的实例共用锁文件的通道，
 * 通过 {@link #LOCK_FILES} 记录各会话的持有情况，因为关闭任一通道都可能释放 JVM 在该文件上的全部锁。
 */
public class FSLockManager extends AbstractLockManager {

    public static final String LOCK_DIRECTORY = "lockDirectory";

    private static class LockFile {
        private final FileChannel channel;
        private FileLock lock;
        private final Set<String> sharedHolders = new HashSet<>();
        private String exclusiveHolder;

        private LockFile(FileChannel channel) {
            this.channel = channel;
        }

        private boolean isUnused() {
            return exclusiveHolder == null && sharedHolders.isEmpty();
        }
    }

    /**
     * 锁文件 -> JVM 内的持有情况，所有访问都在该对象上同步
     */
    private static final Map<Path, LockFile> LOCK_FILES = new HashMap<>();

    private final Path lockDirectory;

    public FSLockManager(LockManagerSettings settings) {
        super(settings);

        String directory = settings.requireString(LOCK_DIRECTORY);
        try {
            this.lockDirectory = Paths.get(directory).toAbsolutePath().normalize();
            Files.createDirectories(lockDirectory);
        } catch (IOException | InvalidPathException e) {
            throw new ConfigException("Cannot use lock directory `" + directory + "`.", e);
        }
    }

    @Override
    protected boolean doLock(List<String> paths, LockType type) {
        List<String> locked = new ArrayList<>();

        for (String path : paths) {
            boolean ok;
            try {
                ok = doSingleLock(getLockFile(path), type);
            } catch (IOException e) {
                doUnlock(locked, type);
                throw new LockException("Failed to lock `" + path + "`.", e);
            }

            if (!ok) {
                doUnlock(locked, type);
                return false;
            }
            locked.add(path);
        }

        return true;
    }

    private boolean doSingleLock(Path file, LockType type) throws IOException {
        String me = session.getValue();

        synchronized (LOCK_FILES) {
            LockFile lf = LOCK_FILES.get(file);
            if (lf == null) {
                lf = new LockFile(FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE));
                LOCK_FILES.put(file, lf);
            }

            boolean ok = type == LockType.SHARED ? lockShared(lf, me) : lockExclusive(lf, me);
            release(file, lf);
            return ok;
        }
    }

    private boolean lockShared(LockFile lf, String me) throws IOException {
        if (lf.exclusiveHolder != null && !lf.exclusiveHolder.equals(me)) {
            return false;
        }

        if (lf.lock == null) {
            lf.lock = tryLock(lf.channel, true);
            if (lf.lock == null) {
                return false;
            }
        }

        lf.sharedHolders.add(me);
        return true;
    }

    private boolean lockExclusive(LockFile lf, String me) throws IOException {
        if (lf.exclusiveHolder != null) {
            return lf.exclusiveHolder.equals(me);
        }
        for (String holder : lf.sharedHolders) {
            if (!holder.equals(me)) {
                return false;
            }
        }

        // 未加锁，或者只有自己持有共享锁，需升级
        if (lf.lock != null) {
            lf.lock.release();
            lf.lock = null;
        }

        lf.lock = tryLock(lf.channel, false);
        if (lf.lock == null) {
            if (!lf.sharedHolders.isEmpty()) {
                lf.lock = tryLock(lf.channel, true);
                if (lf.lock == null) {
                    logger.warn("Lost shared lock on {} while upgrading.", lf.channel);
                    lf.sharedHolders.clear();
                }
            }
            return false;
        }

        lf.exclusiveHolder = me;
        return true;
    }

    private FileLock tryLock(FileChannel channel, boolean shared) throws IOException {
        try {
            return channel.tryLock(0L, Long.MAX_VALUE, shared);
        } catch (OverlappingFileLockException e) {
            return null;
        }
    }

    @Override
    protected boolean doUnlock(List<String> paths, LockType type) {
        String me = session.getValue();
        boolean ok = true;

        synchronized (LOCK_FILES) {
            for (String path : paths) {
                Path file = getLockFile(path);
                LockFile lf = LOCK_FILES.get(file);
                if (lf == null) {
                    continue;
                }

                try {
                    if (type == LockType.SHARED) {
                        lf.sharedHolders.remove(me);
                    } else if (me.equals(lf.exclusiveHolder)) {
                        lf.exclusiveHolder = null;
                        if (!lf.sharedHolders.isEmpty()) {
                            // 仍持有共享锁，降级
                            lf.lock.release();
                            lf.lock = tryLock(lf.channel, true);
                            if (lf.lock == null) {
                                logger.warn("Lost shared lock on `{}` while downgrading.", path);
                                lf.sharedHolders.clear();
                                ok = false;
                            }
                        }
                    }
                    release(file, lf);
                } catch (IOException e) {
                    logger.warn("Failed to unlock `{}`.", path, e);
                    ok = false;
                }
            }
        }

        return ok;
    }

    /**
     * 没有任何会话持有时释放文件锁并关闭通道
     */
    private static void release(Path file, LockFile lf) throws IOException {
        if (!lf.isUnused()) {
            return;
        }

        LOCK_FILES.remove(file);
        try {
            if (lf.lock != null && lf.lock.isValid()) {
                lf.lock.release();
            }
        } finally {
            lf.channel.close();
        }
    }

    Path getLockFile(String path) {
        return lockDirectory.resolve(sha1Base36(path) + ".lock");
    }

    /**
     * 释放本实例持有的所有锁
     */
    @Override
    public void close() {
        String me = session.getValue();

        synchronized (LOCK_FILES) {
            for (Map.Entry<Path, LockFile> e : new ArrayList<>(LOCK_FILES.entrySet())) {
                LockFile lf = e.getValue();
                boolean held = lf.sharedHolders.remove(me);
                if (me.equals(lf.exclusiveHolder)) {
                    lf.exclusiveHolder = null;
                    held = true;
                }

                if (held) {
                    try {
                        release(e.getKey(), lf);
                    } catch (IOException ex) {
                        logger.warn("Failed to release lock file {}.", e.getKey(), ex);
                    }
                }
            }
        }
    }
}
