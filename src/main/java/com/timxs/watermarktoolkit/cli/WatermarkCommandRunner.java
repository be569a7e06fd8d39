package com.timxs.watermarktoolkit.cli;

import com.timxs.watermarktoolkit.config.ProcessingSettings;
import com.timxs.watermarktoolkit.exception.WatermarkException;
import com.timxs.watermarktoolkit.model.BatchJob;
import com.timxs.watermarktoolkit.model.BatchProgress;
import com.timxs.watermarktoolkit.model.BatchResult;
import com.timxs.watermarktoolkit.model.FileResult;
import com.timxs.watermarktoolkit.model.OutputFormat;
import com.timxs.watermarktoolkit.model.WatermarkPosition;
import com.timxs.watermarktoolkit.service.BatchRunner;
import com.timxs.watermarktoolkit.service.ImageFileScanner;
import com.timxs.watermarktoolkit.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 命令行入口
 * 把 --name=value 形式的参数转换为批处理任务，通过日志输出进度和汇总
 * 退出码：0 全部成功，1 部分文件失败，2 任务无法开始或参数错误
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "watermark-toolkit.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WatermarkCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;

    public static final int EXIT_FAILURES = 1;

    public static final int EXIT_NOT_STARTED = 2;

    /**
     * 默认设置文件路径
     */
    static final String DEFAULT_SETTINGS_FILE = "bin/settings.json";

    private static final String USAGE = """
        用法: watermark-toolkit [--input=<目录或文件>]... [选项] [文件...]
          --settings=<文件>        设置文件（默认 bin/settings.json）
          --input=<路径>           输入目录或图片，可重复
          --output=<目录>          输出目录
          --watermark=<文件>       水印图片
          --format=<格式>          jpg | png | tiff | webp
          --opacity=<0.1-1.0>      水印透明度
          --scale=<0.1-1.0>        水印缩放比例
          --position=<位置>        top-left | top-right | bottom-left | bottom-right | center
          --workers=<数量>         并行处理的文件数
          --save-settings          把本次使用的设置写回设置文件""";

    private final SettingsManager settingsManager;

    private final ImageFileScanner fileScanner;

    private final BatchRunner batchRunner;

    private volatile int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * 执行一次批处理
     *
     * @param args 命令行参数
     * @return 退出码
     */
    int execute(ApplicationArguments args) {
        Path settingsFile = Path.of(option(args, "settings", DEFAULT_SETTINGS_FILE));
        ProcessingSettings settings = settingsManager.load(settingsFile).block();
        if (settings == null) {
            settings = settingsManager.defaults();
        }

        try {
            applyOverrides(args, settings);
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            log.info(USAGE);
            return EXIT_NOT_STARTED;
        }

        List<Path> inputs = inputPaths(args, settings);
        if (inputs.isEmpty()) {
            log.error("未指定输入目录或文件");
            log.info(USAGE);
            return EXIT_NOT_STARTED;
        }

        if (args.containsOption("save-settings")) {
            try {
                settingsManager.save(settingsFile, settings).block();
            } catch (WatermarkException e) {
                log.warn("保存设置失败: {}", e.getMessage());
            }
        }

        List<Path> files;
        try {
            files = fileScanner.scan(inputs);
        } catch (WatermarkException e) {
            log.error("无法读取输入 [{}]: {}", e.getReason(), e.getMessage());
            return EXIT_NOT_STARTED;
        }
        if (files.isEmpty()) {
            log.warn("没有找到可处理的图片（支持 jpg、jpeg、png）");
            return EXIT_OK;
        }

        BatchResult result;
        try {
            result = batchRunner.run(BatchJob.from(settings, files), this::logProgress).block();
        } catch (WatermarkException e) {
            log.error("批处理无法开始 [{}]: {}", e.getReason(), e.getMessage());
            return EXIT_NOT_STARTED;
        }
        if (result == null) {
            return EXIT_NOT_STARTED;
        }
        logSummary(result);
        return result.hasFailures() ? EXIT_FAILURES : EXIT_OK;
    }

    /**
     * 用命令行参数覆盖设置
     *
     * @throws IllegalArgumentException 参数值无效时抛出
     */
    private void applyOverrides(ApplicationArguments args, ProcessingSettings settings) {
        List<String> inputs = args.getOptionValues("input");
        if (inputs != null && !inputs.isEmpty()) {
            settings.setInputDirectory(inputs.get(0));
        }
        String output = option(args, "output", null);
        if (output != null) {
            settings.getOutput().setDirectory(output);
        }
        String watermark = option(args, "watermark", null);
        if (watermark != null) {
            settings.getWatermark().setImagePath(watermark);
        }
        String format = option(args, "format", null);
        if (format != null) {
            settings.getOutput().setFormat(OutputFormat.fromName(format));
        }
        String opacity = option(args, "opacity", null);
        if (opacity != null) {
            settings.getWatermark().setOpacity(Float.parseFloat(opacity));
        }
        String scale = option(args, "scale", null);
        if (scale != null) {
            settings.getWatermark().setScale(Float.parseFloat(scale));
        }
        String position = option(args, "position", null);
        if (position != null) {
            settings.getWatermark().setPosition(WatermarkPosition.parse(position));
        }
        String workers = option(args, "workers", null);
        if (workers != null) {
            settings.setWorkers(Integer.parseInt(workers));
        }
    }

    /**
     * 收集输入路径
     * 优先使用 --input 和位置参数，都没有时使用设置中的输入目录
     */
    private List<Path> inputPaths(ApplicationArguments args, ProcessingSettings settings) {
        List<Path> paths = new ArrayList<>();
        List<String> inputs = args.getOptionValues("input");
        if (inputs != null) {
            inputs.stream().filter(value -> !value.isBlank()).map(Path::of).forEach(paths::add);
        }
        args.getNonOptionArgs().stream().filter(value -> !value.isBlank()).map(Path::of).forEach(paths::add);
        if (paths.isEmpty() && settings.getInputDirectory() != null && !settings.getInputDirectory().isBlank()) {
            paths.add(Path.of(settings.getInputDirectory()));
        }
        return paths;
    }

    private void logProgress(BatchProgress progress) {
        log.info("[{}/{}] {}% {} {}", progress.processed(), progress.total(), Math.round(progress.percent()),
            progress.file().getFileName(), progress.success() ? "完成" : "失败");
    }

    private void logSummary(BatchResult result) {
        for (FileResult fileResult : result.results()) {
            if (!fileResult.isSuccess()) {
                log.warn("失败: {} [{}] {}", fileResult.input(), fileResult.reason(), fileResult.message());
            }
        }
        if (result.cancelled()) {
            log.info("已取消，成功处理 {}/{} 张图片，未处理 {} 张", result.succeeded(), result.total(), result.skipped());
        } else {
            log.info("水印添加完成！成功处理 {}/{} 张图片，耗时 {} ms",
                result.succeeded(), result.total(), result.durationMs());
        }
    }

    /**
     * 获取选项值，重复出现时取最后一个
     */
    private static String option(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
