package com.timxs.watermarktoolkit.service.impl;

import com.timxs.watermarktoolkit.exception.ErrorReason;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.BatchJob;
import com.timxs.watermarktoolkit.model.BatchProgress;
import com.timxs.watermarktoolkit.model.BatchResult;
import com.timxs.watermarktoolkit.model.FileResult;
import com.timxs.watermarktoolkit.service.BatchControl;
import com.timxs.watermarktoolkit.service.BatchRunner;
import com.timxs.watermarktoolkit.service.ImageEncoder;
import com.timxs.watermarktoolkit.service.ImageLoader;
import com.timxs.watermarktoolkit.service.ProgressListener;
import com.timxs.watermarktoolkit.service.WatermarkCompositor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.function.Function;

/**
 * 批处理器实现
 * 处理顺序：预检（水印、输出目录、编码器） -> 逐个文件 读取 -> 合成 -> 编码 -> 写出
 * 单线程时使用 concatMap 严格顺序执行；多线程时使用 flatMapSequential，结果仍按输入顺序回调
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchRunnerImpl implements BatchRunner {

    /**
     * 图片读取器
     */
    private final ImageLoader imageLoader;

    /**
     * 水印合成器
     */
    private final WatermarkCompositor compositor;

    /**
     * 图片编码器
     */
    private final ImageEncoder imageEncoder;

    @Override
    public Mono<BatchResult> run(BatchJob job, ProgressListener listener) {
        return run(job, listener, new BatchControl());
    }

    /**
     * 执行批处理
     * 预检在弹性线程池中执行，预检失败时整个任务以 WatermarkException 结束，不回调进度
     *
     * @param job      批处理任务
     * @param listener 进度回调
     * @param control  控制句柄
     * @return 汇总结果（异步）
     */
    @Override
    public Mono<BatchResult> run(BatchJob job, ProgressListener listener, BatchControl control) {
        if (job == null) {
            return Mono.error(WatermarkException.invalidConfig("批处理任务不能为空"));
        }
        ProgressListener progressListener = listener != null ? listener : ProgressListener.NOOP;
        BatchControl batchControl = control != null ? control : new BatchControl();

        return Mono.fromCallable(() -> prepare(job))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.error("批处理无法开始: {}", e.getMessage()))
            .flatMap(prepared -> process(job, prepared, progressListener, batchControl));
    }

    /**
     * 预检任务级配置
     *
     * @param job 批处理任务
     * @return 已加载的水印和输出路径分配器
     * @throws WatermarkException 水印不可用、输出目录不可写、文件名前缀不合法或不支持输出格式时抛出
     */
    private PreparedJob prepare(BatchJob job) {
        Path watermarkPath = job.watermarkPath();
        if (watermarkPath == null) {
            throw WatermarkException.invalidConfig("未设置水印图片");
        }
        if (!Files.isRegularFile(watermarkPath)) {
            throw WatermarkException.invalidConfig("水印图片不存在: " + watermarkPath);
        }
        BufferedImage watermark = imageLoader.load(watermarkPath);
        if (watermark.getWidth() <= 0 || watermark.getHeight() <= 0) {
            throw WatermarkException.invalidConfig("水印图片尺寸无效: " + watermarkPath);
        }

        Path outputDirectory = job.outputDirectory();
        if (outputDirectory == null) {
            throw WatermarkException.invalidConfig("未设置输出目录");
        }
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw WatermarkException.filesystemError("无法创建输出目录: " + outputDirectory, e);
        }
        if (!Files.isWritable(outputDirectory)) {
            throw WatermarkException.filesystemError("输出目录不可写: " + outputDirectory, null);
        }

        String prefixProblem = job.naming().prefixProblem();
        if (prefixProblem != null) {
            throw WatermarkException.invalidConfig(prefixProblem);
        }

        if (!imageEncoder.supportsFormat(job.format())) {
            throw WatermarkException.encodeError("当前环境没有 " + job.format() + " 编码器", null);
        }

        log.info("开始批处理: {} 个文件, 水印: {} ({}x{}), 输出: {} -> {}, 并行数: {}",
            job.inputs().size(), watermarkPath.getFileName(), watermark.getWidth(), watermark.getHeight(),
            job.format(), outputDirectory, job.workers());
        return new PreparedJob(watermark,
            new OutputPathAllocator(outputDirectory, job.format(), job.naming()));
    }

    /**
     * 处理所有文件并汇总
     */
    private Mono<BatchResult> process(BatchJob job, PreparedJob prepared, ProgressListener listener,
                                      BatchControl control) {
        List<Path> inputs = job.inputs();
        int total = inputs.size();
        long startTime = System.currentTimeMillis();
        ProgressCounter counter = new ProgressCounter();

        Function<Integer, Mono<FileResult>> worker = index -> Mono.defer(() -> {
            // 取消只在开始下一个文件前检查
            if (control.isCancelled()) {
                return Mono.empty();
            }
            Path input = inputs.get(index);
            Path output;
            try {
                output = prepared.allocator().allocate(input, index + 1);
            } catch (WatermarkException e) {
                return Mono.just(failed(input, e.getReason(), e.getMessage(), System.currentTimeMillis()));
            } catch (RuntimeException e) {
                return Mono.just(failed(input, ErrorReason.FILESYSTEM_ERROR,
                    "无法分配输出文件: " + e.getMessage(), System.currentTimeMillis()));
            }
            return Mono.fromCallable(() -> processFile(job, prepared.watermark(), input, output))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    // 未归类的异常
                    log.error("处理文件发生严重错误: {} - {}", input, e.getMessage(), e);
                    return Mono.just(FileResult.failed(input, ErrorReason.ENCODE_ERROR,
                        "处理错误: " + e.getClass().getSimpleName() + " - " + e.getMessage(), 0));
                });
        });

        Flux<Integer> indexes = Flux.range(0, total);
        Flux<FileResult> results = job.workers() <= 1
            ? indexes.concatMap(worker)
            : indexes.flatMapSequential(worker, job.workers());

        return results
            .doOnNext(result -> report(result, counter, total, listener))
            .collectList()
            .map(list -> {
                long duration = System.currentTimeMillis() - startTime;
                boolean cancelled = control.isCancelled() && list.size() < total;
                BatchResult batchResult = BatchResult.of(list, total, cancelled, duration);
                if (cancelled) {
                    log.info("批处理已取消: 成功 {}, 失败 {}, 未处理 {}, 耗时 {} ms",
                        batchResult.succeeded(), batchResult.failed(), batchResult.skipped(), duration);
                } else {
                    log.info("批处理完成: 成功 {}/{}, 失败 {}, 耗时 {} ms",
                        batchResult.succeeded(), total, batchResult.failed(), duration);
                }
                return batchResult;
            });
    }

    /**
     * 处理单个文件（同步方法）
     * 每一步的失败都转换为失败结果，不向外抛出
     *
     * @param job       批处理任务
     * @param watermark 水印图片
     * @param input     输入文件
     * @param output    输出文件
     * @return 处理结果
     */
    private FileResult processFile(BatchJob job, BufferedImage watermark, Path input, Path output) {
        long startTime = System.currentTimeMillis();

        // 步骤1：读取
        BufferedImage source;
        try {
            source = imageLoader.load(input);
        } catch (WatermarkException e) {
            return failed(input, e.getReason(), e.getMessage(), startTime);
        } catch (RuntimeException e) {
            return failed(input, ErrorReason.DECODE_ERROR, e.getMessage(), startTime);
        }

        // 步骤2：合成水印
        BufferedImage composed;
        try {
            composed = compositor.compose(source, watermark, job.config());
        } catch (WatermarkException e) {
            return failed(input, e.getReason(), e.getMessage(), startTime);
        } catch (RuntimeException e) {
            return failed(input, ErrorReason.UNSUPPORTED_COLOR_MODE, "水印合成失败: " + e.getMessage(), startTime);
        }

        // 步骤3：编码
        byte[] data;
        try {
            data = imageEncoder.encode(composed, job.format(), job.formatOptions());
        } catch (WatermarkException e) {
            return failed(input, e.getReason(), e.getMessage(), startTime);
        } catch (RuntimeException e) {
            return failed(input, ErrorReason.ENCODE_ERROR, "编码失败: " + e.getMessage(), startTime);
        }

        // 步骤4：写出，不覆盖已有文件
        try {
            Files.write(output, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            return failed(input, ErrorReason.ENCODE_ERROR, "写入失败 " + output + ": " + e.getMessage(), startTime);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.debug("处理成功: {} -> {} ({} ms)", input.getFileName(), output.getFileName(), duration);
        return FileResult.success(input, output, duration);
    }

    private FileResult failed(Path input, ErrorReason reason, String message, long startTime) {
        log.warn("处理失败: {} [{}] {}", input.getFileName(), reason, message);
        return FileResult.failed(input, reason, message, System.currentTimeMillis() - startTime);
    }

    /**
     * 回调进度
     * 只在 onNext 信号中调用，计数器不会被并发修改
     */
    private void report(FileResult result, ProgressCounter counter, int total, ProgressListener listener) {
        counter.processed++;
        if (result.isSuccess()) {
            counter.succeeded++;
        } else {
            counter.failed++;
        }
        BatchProgress progress = new BatchProgress(counter.processed, total, result.input(), result.isSuccess(),
            counter.succeeded, counter.failed);
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("进度回调异常: {}", e.getMessage(), e);
        }
    }

    /**
     * 预检通过的任务数据
     *
     * @param watermark 已解码的水印图片
     * @param allocator 输出路径分配器
     */
    private record PreparedJob(BufferedImage watermark, OutputPathAllocator allocator) {
    }

    private static final class ProgressCounter {
        private int processed;
        private int succeeded;
        private int failed;
    }
}
