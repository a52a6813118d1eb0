package site.redigo.sync;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 计数等待组。
 *
 * <p>调用方在开始一项任务前{@link #add(int)}，结束时{@link #done()}；
 * {@link #await()}阻塞到计数归零。与{@link java.util.concurrent.CountDownLatch}
 * 不同，计数可以在等待期间继续增加，并且支持带超时的等待。
 *
 * <p>用途：
 * <ul>
 *   <li>连接关闭前等待已登记的写操作完成（带超时）
 *   <li>服务器关闭时等待所有连接任务结束
 * </ul>
 *
 * @author hnfy258
 * @since 1.0
 */
public final class WaitGroup {

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition zero = lock.newCondition();

    private int count;

    /**
     * 增加计数。
     *
     * @param delta 增量，可以为负
     * @throws IllegalStateException 如果计数变为负数
     */
    public void add(final int delta) {
        lock.lock();
        try {
            final int next = count + delta;
            if (next < 0) {
                throw new IllegalStateException("WaitGroup计数不能为负: " + next);
            }
            count = next;
            if (count == 0) {
                zero.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 计数减一。
     */
    public void done() {
        add(-1);
    }

    /**
     * 阻塞直到计数归零。
     *
     * @throws InterruptedException 等待期间被中断
     */
    public void await() throws InterruptedException {
        lock.lock();
        try {
            while (count > 0) {
                zero.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 阻塞直到计数归零或超时。
     *
     * @param timeout 最长等待时间
     * @param unit 时间单位
     * @return 计数归零返回true，超时返回false
     * @throws InterruptedException 等待期间被中断
     */
    public boolean await(final long timeout, final TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (count > 0) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = zero.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前计数，仅用于监控和日志。
     */
    public int getCount() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }
}
