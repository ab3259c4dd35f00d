package com.edge.precision.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库，所有使用 OpenCV 的组件在构造时调用
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
        try {
            // JDK 12+ 不再支持 loadShared，使用 openpnp 的本地解压加载
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library", e);
            throw new IllegalStateException("OpenCV native library not found", e);
        }
        loaded = true;
    }
}
