package com.timxs.watermarktoolkit.model;

import java.util.List;

/**
 * 批处理汇总结果
 * 结果按输入顺序排列
 *
 * @param results    每个文件的处理结果
 * @param total      输入文件总数
 * @param succeeded  成功数量
 * @param failed     失败数量
 * @param cancelled  是否在中途被取消
 * @param durationMs 总耗时（毫秒）
 */
public record BatchResult(
    List<FileResult> results,
    int total,
    int succeeded,
    int failed,
    boolean cancelled,
    long durationMs
) {
    public BatchResult {
        results = List.copyOf(results);
    }

    /**
     * 根据文件结果汇总
     *
     * @param results    按输入顺序排列的文件结果
     * @param total      输入文件总数
     * @param cancelled  是否被取消
     * @param durationMs 总耗时
     * @return 汇总结果
     */
    public static BatchResult of(List<FileResult> results, int total, boolean cancelled, long durationMs) {
        int succeeded = (int) results.stream().filter(FileResult::isSuccess).count();
        return new BatchResult(results, total, succeeded, results.size() - succeeded, cancelled, durationMs);
    }

    /**
     * 未开始处理的文件数量（仅在取消时大于 0）
     */
    public int skipped() {
        return total - results.size();
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
