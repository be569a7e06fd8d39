package com.timxs.watermarktoolkit.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 批处理控制句柄
 * 取消在文件之间生效：正在处理的文件会完成，尚未开始的文件不再处理
 */
public class BatchControl {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * 请求取消
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
