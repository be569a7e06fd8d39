package com.timxs.watermarktoolkit.exception;

/**
 * 失败原因分类
 */
public enum ErrorReason {
    /**
     * 参数超出范围、缺少水印图片等配置问题
     */
    INVALID_CONFIG,

    /**
     * 图片无法解码
     */
    DECODE_ERROR,

    /**
     * 编码或写出结果失败
     */
    ENCODE_ERROR,

    /**
     * 无法转换为 RGBA 进行混合的像素格式（如 CMYK）
     */
    UNSUPPORTED_COLOR_MODE,

    /**
     * 输出目录不可用
     */
    FILESYSTEM_ERROR
}
