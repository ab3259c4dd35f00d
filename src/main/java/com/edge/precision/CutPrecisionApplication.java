package com.edge.precision;

import com.edge.precision.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 切割轮廓精度测量
 */
@SpringBootApplication
public class CutPrecisionApplication {

    public static void main(String[] args) {
        NativeLibraryLoader.loadNativeLibraries();
        System.exit(SpringApplication.exit(SpringApplication.run(CutPrecisionApplication.class, args)));
    }
}
