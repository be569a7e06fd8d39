package com.timxs.watermarktoolkit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.spi.IIORegistry;
import javax.imageio.spi.IIOServiceProvider;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.spi.ImageWriterSpi;
import java.util.ArrayList;
import java.util.List;

/**
 * ImageIO 插件注册器
 * 应用启动时确保 WebP 读写器已注册，关闭时注销本类注册的 SPI
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
@Component
public class ImageIoRegistrar {

    static final String WEBP_READER_SPI = "com.luciad.imageio.webp.WebPImageReaderSpi";

    static final String WEBP_WRITER_SPI = "com.luciad.imageio.webp.WebPImageWriterSpi";

    /**
     * 已注册的 SPI 列表，用于关闭时注销
     */
    private final List<IIOServiceProvider> registeredSpis = new ArrayList<>();

    /**
     * 应用启动时调用
     * 先让 ImageIO 扫描类路径，打包运行时类加载器不同导致扫描不到的再手动注册
     */
    @PostConstruct
    public synchronized void start() {
        ImageIO.scanForPlugins();
        ClassLoader classLoader = this.getClass().getClassLoader();
        registerIfAbsent(classLoader, WEBP_READER_SPI, ImageReaderSpi.class);
        registerIfAbsent(classLoader, WEBP_WRITER_SPI, ImageWriterSpi.class);
    }

    /**
     * 应用关闭时调用
     * 只注销由本类注册的 SPI
     */
    @PreDestroy
    public synchronized void stop() {
        if (registeredSpis.isEmpty()) {
            return;
        }
        IIORegistry registry = IIORegistry.getDefaultInstance();
        for (IIOServiceProvider spi : registeredSpis) {
            try {
                registry.deregisterServiceProvider(spi);
                log.info("SPI 注销成功: {}", spi.getClass().getName());
            } catch (RuntimeException e) {
                log.warn("SPI 注销失败: {} - {}", spi.getClass().getName(), e.getMessage());
            }
        }
        registeredSpis.clear();
    }

    /**
     * 本类注册的 SPI 数量
     */
    synchronized int registeredCount() {
        return registeredSpis.size();
    }

    /**
     * 类路径上存在且尚未注册时注册 SPI
     *
     * @param classLoader 类加载器
     * @param className   SPI 类名
     * @param category    SPI 类别
     */
    private <T extends IIOServiceProvider> void registerIfAbsent(ClassLoader classLoader, String className,
                                                                 Class<T> category) {
        IIORegistry registry = IIORegistry.getDefaultInstance();
        try {
            Class<?> spiClass = classLoader.loadClass(className);
            if (registry.getServiceProviderByClass(spiClass) != null) {
                log.debug("SPI 已注册: {}", className);
                return;
            }
            T spi = category.cast(spiClass.getDeclaredConstructor().newInstance());
            registry.registerServiceProvider(spi, category);
            registeredSpis.add(spi);
            log.info("SPI 注册成功: {}", className);
        } catch (ClassNotFoundException e) {
            log.warn("类路径上没有 {}，WebP 不可用", className);
        } catch (ReflectiveOperationException | ClassCastException | LinkageError e) {
            log.warn("SPI 注册失败: {} - {}", className, e.getMessage());
        }
    }
}
