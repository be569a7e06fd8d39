package com.timxs.watermarktoolkit.model;

import com.timxs.watermarktoolkit.exception.ErrorReason;

import java.nio.file.Path;

/**
 * 单个文件的处理结果
 *
 * @param input      输入文件
 * @param output     输出文件（失败时为 null）
 * @param status     处理状态
 * @param reason     失败原因（成功时为 null）
 * @param message    失败信息（成功时为 null）
 * @param durationMs 处理耗时（毫秒）
 */
public record FileResult(
    Path input,
    Path output,
    ProcessingStatus status,
    ErrorReason reason,
    String message,
    long durationMs
) {
    /**
     * 创建成功结果
     */
    public static FileResult success(Path input, Path output, long durationMs) {
        return new FileResult(input, output, ProcessingStatus.SUCCESS, null, null, durationMs);
    }

    /**
     * 创建失败结果
     */
    public static FileResult failed(Path input, ErrorReason reason, String message, long durationMs) {
        return new FileResult(input, null, ProcessingStatus.FAILED, reason, message, durationMs);
    }

    public boolean isSuccess() {
        return status == ProcessingStatus.SUCCESS;
    }
}
