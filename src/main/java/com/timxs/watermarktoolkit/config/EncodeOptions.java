package com.timxs.watermarktoolkit.config;

import com.timxs.watermarktoolkit.model.OutputFormat;

/**
 * 某一输出格式的编码参数
 */
public interface EncodeOptions {

    /**
     * 参数所属的输出格式
     */
    OutputFormat format();
}
