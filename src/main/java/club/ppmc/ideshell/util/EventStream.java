/**
 * EventStream.java
 *
 * 一个可消费、可取消的异步事件通道。生产者 (构建会话、终端命令、进程读取线程) 通过 offer() 写入，
 * 并在结束时调用 complete()；消费者通过 poll()/迭代器按写入顺序逐个取出，或调用 cancel() 提前退订。
 * 它把"最多一个存活进程"和取消语义显式地暴露出来，无需依赖任何UI框架即可测试。
 */
package club.ppmc.ideshell.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class EventStream<T> implements Iterable<T>, AutoCloseable {

    /** 队列中的一项。结束标记是 item 为 null 的那个实例，按引用比较。 */
    private record Signal<T>(T item) {}

    private final Signal<T> end = new Signal<>(null);
    private final BlockingQueue<Signal<T>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Runnable onCancel;
    private volatile boolean finished;

    public EventStream() {
        this(() -> {});
    }

    /**
     * @param onCancel 消费者取消订阅时执行的回调，例如从会话的订阅者列表中移除自身。
     */
    public EventStream(Runnable onCancel) {
        this.onCancel = onCancel;
    }

    /**
     * 写入一个元素。通道已完成或已被取消时返回 false，元素被丢弃。
     */
    public boolean offer(T item) {
        if (completed.get() || cancelled.get()) {
            return false;
        }
        return queue.offer(new Signal<>(Objects.requireNonNull(item, "item")));
    }

    /** 生产者声明不会再有新元素。重复调用无副作用。 */
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            queue.offer(end);
        }
    }

    /**
     * 等待下一个元素。超时或通道已经结束时返回空。
     * 调用方可通过 {@link #isFinished()} 区分这两种情况。
     */
    public Optional<T> poll(Duration timeout) throws InterruptedException {
        if (finished) {
            return Optional.empty();
        }
        return unwrap(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * 阻塞收集所有剩余元素，直到生产者调用 complete()。
     *
     * @throws TimeoutException 在限定时间内通道没有结束。
     */
    public List<T> collect(Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<T> items = new ArrayList<>();
        while (!finished) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TimeoutException("事件流在 " + timeout + " 内没有结束");
            }
            unwrap(queue.poll(remaining, TimeUnit.NANOSECONDS)).ifPresent(items::add);
        }
        return items;
    }

    /** 结束标记已被消费，不会再有元素。 */
    public boolean isFinished() {
        return finished;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** 消费者退订：丢弃未读元素并通知生产者。 */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            finished = true;
            queue.clear();
            // 唤醒可能阻塞在 take() 上的迭代器
            queue.offer(end);
            onCancel.run();
        }
    }

    @Override
    public void close() {
        cancel();
    }

    private Optional<T> unwrap(Signal<T> next) {
        if (next == null) {
            return Optional.empty();
        }
        if (next == end) {
            finished = true;
            return Optional.empty();
        }
        return Optional.of(next.item());
    }

    /**
     * 阻塞式迭代器，直到通道结束或被取消。线程被中断时视为结束并保留中断标志。
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private T buffered;

            @Override
            public boolean hasNext() {
                while (buffered == null && !finished) {
                    try {
                        buffered = unwrap(queue.take()).orElse(null);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
                return buffered != null;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T item = buffered;
                buffered = null;
                return item;
            }
        };
    }
}
