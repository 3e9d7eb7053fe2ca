package com.aqua.stream;

import com.aqua.stream.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CameraStreamApplication {

    public static void main(String[] args) {
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(CameraStreamApplication.class, args);
    }
}
