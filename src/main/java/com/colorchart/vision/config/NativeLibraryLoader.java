package com.colorchart.vision.config;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库，必须在任何 OpenCV 调用之前执行
 */
public final class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 加载 OpenCV native 库，重复调用无副作用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        boolean isNativeImage = System.getProperty("org.graalvm.nativeimage.imagecode") != null;

        if (!isNativeImage) {
            // JAR 模式下，使用 openpnp 打包的库（loadShared 在 Java 12+ 上不可用）
            logger.info("Running in JAR mode, loading OpenCV via openpnp...");
            try {
                nu.pattern.OpenCV.loadLocally();
                logger.info("OpenCV {} loaded successfully via openpnp (JAR mode)", Core.VERSION);
            } catch (UnsatisfiedLinkError | RuntimeException e) {
                logger.error("Failed to load OpenCV via openpnp", e);
                throw new IllegalStateException("Failed to load OpenCV native library", e);
            }
            loaded = true;
            return;
        }

        logger.info("Running in native-image mode, loading OpenCV from application directory...");
        loadOpenCVNative(System.getProperty("user.dir"));
        loaded = true;
    }

    /**
     * native-image 模式：先从应用目录加载，再回退到系统库路径
     */
    private static void loadOpenCVNative(String appDir) {
        String libName = Core.NATIVE_LIBRARY_NAME;
        String osName = System.getProperty("os.name").toLowerCase();
        String libFileName;

        // openpnp 的 OpenCV 在 Windows 上没有 lib 前缀
        if (osName.contains("win")) {
            libFileName = libName + ".dll";
        } else if (osName.contains("mac")) {
            libFileName = "lib" + libName + ".dylib";
        } else {
            libFileName = "lib" + libName + ".so";
        }

        File libFile = new File(appDir, libFileName);
        if (libFile.exists()) {
            try {
                System.load(libFile.getAbsolutePath());
                logger.info("OpenCV loaded successfully from: {}", libFile.getAbsolutePath());
                return;
            } catch (UnsatisfiedLinkError e) {
                logger.warn("Failed to load OpenCV from {}: {}", libFile, e.getMessage());
            }
        }

        try {
            System.loadLibrary(libName);
            logger.info("OpenCV loaded successfully from system library path");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in the application directory or system library path", libFileName);
            throw new IllegalStateException("OpenCV native library not found: " + libFileName, e);
        }
    }
}
