package com.aqua.stream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库，必须在任何 org.opencv 调用之前执行
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static final String OPENCV_LIB_NAME = "opencv_java470";

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 预加载 OpenCV native 库（幂等）
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        // openpnp 包内自带各平台的库，解压到临时目录后加载
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            logger.info("OpenCV {} loaded via openpnp", org.opencv.core.Core.VERSION);
            return;
        } catch (Throwable e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
        }

        loadFromDirectory(System.getProperty("user.dir"));
        loaded = true;
    }

    /**
     * 回退：从应用目录或系统库路径加载
     */
    private static void loadFromDirectory(String appDir) {
        File libFile = new File(appDir, System.mapLibraryName(OPENCV_LIB_NAME));
        if (libFile.exists()) {
            try {
                System.load(libFile.getAbsolutePath());
                logger.info("OpenCV loaded from: {}", libFile.getAbsolutePath());
                return;
            } catch (UnsatisfiedLinkError e) {
                logger.warn("Failed to load OpenCV from {}: {}", libFile, e.getMessage());
            }
        }

        try {
            System.loadLibrary(OPENCV_LIB_NAME);
            logger.info("OpenCV loaded from system library path");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in the application directory or system library path",
                    libFile.getName());
            throw new RuntimeException("OpenCV native library not found: " + libFile.getName(), e);
        }
    }
}
