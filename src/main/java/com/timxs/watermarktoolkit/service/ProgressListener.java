package com.timxs.watermarktoolkit.service;

import com.timxs.watermarktoolkit.model.BatchProgress;

/**
 * 批处理进度回调
 * 每处理完一个文件按输入顺序调用一次，调用之间不会并发
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * 不做任何处理的回调
     */
    ProgressListener NOOP = progress -> {
    };

    void onProgress(BatchProgress progress);
}
