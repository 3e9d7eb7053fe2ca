package com.aqua.stream.server;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 某类端点的活动连接数，仅用于观测
 */
public class ConnectionCounter {

    private final AtomicInteger active = new AtomicInteger(0);
    private final AtomicInteger total = new AtomicInteger(0);

    /**
     * @return 加一后的活动连接数
     */
    public int connected() {
        total.incrementAndGet();
        return active.incrementAndGet();
    }

    /**
     * @return 减一后的活动连接数
     */
    public int disconnected() {
        return active.decrementAndGet();
    }

    public int getActive() {
        return active.get();
    }

    public int getTotal() {
        return total.get();
    }
}
