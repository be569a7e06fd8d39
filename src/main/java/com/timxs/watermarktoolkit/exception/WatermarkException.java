package com.timxs.watermarktoolkit.exception;

/**
 * 水印处理异常
 * 携带失败原因分类，批处理据此记录单个文件的失败或终止整个任务
 */
public class WatermarkException extends RuntimeException {

    private final ErrorReason reason;

    public WatermarkException(ErrorReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public WatermarkException(ErrorReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ErrorReason getReason() {
        return reason;
    }

    public static WatermarkException invalidConfig(String message) {
        return new WatermarkException(ErrorReason.INVALID_CONFIG, message);
    }

    public static WatermarkException decodeError(String message, Throwable cause) {
        return new WatermarkException(ErrorReason.DECODE_ERROR, message, cause);
    }

    public static WatermarkException encodeError(String message, Throwable cause) {
        return new WatermarkException(ErrorReason.ENCODE_ERROR, message, cause);
    }

    public static WatermarkException unsupportedColorMode(String message) {
        return new WatermarkException(ErrorReason.UNSUPPORTED_COLOR_MODE, message);
    }

    public static WatermarkException filesystemError(String message, Throwable cause) {
        return new WatermarkException(ErrorReason.FILESYSTEM_ERROR, message, cause);
    }
}
