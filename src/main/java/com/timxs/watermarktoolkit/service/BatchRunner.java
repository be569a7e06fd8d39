package com.timxs.watermarktoolkit.service;

import com.timxs.watermarktoolkit.model.BatchJob;
import com.timxs.watermarktoolkit.model.BatchResult;
import reactor.core.publisher.Mono;

/**
 * 批处理器接口
 * 逐个文件执行 读取 -> 合成水印 -> 编码 -> 写出，单个文件失败不影响其余文件
 */
public interface BatchRunner {

    /**
     * 执行批处理
     *
     * @param job      批处理任务
     * @param listener 进度回调
     * @return 汇总结果（异步）；任务无法开始时以 WatermarkException 结束
     */
    Mono<BatchResult> run(BatchJob job, ProgressListener listener);

    /**
     * 执行可取消的批处理
     *
     * @param job      批处理任务
     * @param listener 进度回调
     * @param control  控制句柄，用于在文件之间取消
     * @return 汇总结果（异步）；任务无法开始时以 WatermarkException 结束
     */
    Mono<BatchResult> run(BatchJob job, ProgressListener listener, BatchControl control);
}
