package com.timxs.watermarktoolkit.model;

/**
 * 单个文件的处理状态
 */
public enum ProcessingStatus {
    /**
     * 处理成功，结果已写入输出目录
     */
    SUCCESS,

    /**
     * 处理失败，不影响其余文件
     */
    FAILED
}
