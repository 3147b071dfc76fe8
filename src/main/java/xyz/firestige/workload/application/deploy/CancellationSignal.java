package xyz.firestige.workload.application.deploy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 部署取消信号
 * <p>
 * 由调用方持有并在任意线程调用 {@link #cancel()}；等待中的轮询会立即醒来。
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * 不会被外部取消的信号
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * 最多等待 timeout
     *
     * @return 等待期间是否已被取消
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
