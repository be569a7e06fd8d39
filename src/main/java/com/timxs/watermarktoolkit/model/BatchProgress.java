package com.timxs.watermarktoolkit.model;

import java.nio.file.Path;

/**
 * 批处理进度
 * 每处理完一个文件回调一次
 *
 * @param processed 已处理数量（从 1 开始）
 * @param total     文件总数
 * @param file      当前文件
 * @param success   当前文件是否成功
 * @param succeeded 累计成功数量
 * @param failed    累计失败数量
 */
public record BatchProgress(
    int processed,
    int total,
    Path file,
    boolean success,
    int succeeded,
    int failed
) {
    /**
     * 完成百分比（0-100）
     */
    public double percent() {
        return total == 0 ? 100.0 : processed * 100.0 / total;
    }
}
