package com.colorchart.vision.service;

import com.colorchart.vision.config.YamlConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 请求中的服务器路径解析
 * <p>
 * 相对路径按配置的输入/输出根目录解析；解析结果必须落在对应根目录内，否则拒绝。
 */
@Component
public class WorkspacePaths {

    @Autowired
    private YamlConfig yamlConfig;

    /**
     * 输入文件（图像、相机标定 JSON），限定在输入根目录内
     */
    public Path resolveInput(String path) {
        return confine(inputRoot(), path, "input");
    }

    /**
     * 输出目录，限定在输出根目录内
     */
    public Path resolveOutput(String path) {
        return confine(outputRoot(), path, "output");
    }

    public Path inputRoot() {
        return Paths.get(yamlConfig.getInput().getDirectory()).toAbsolutePath().normalize();
    }

    public Path outputRoot() {
        return Paths.get(yamlConfig.getOutput().getDirectory()).toAbsolutePath().normalize();
    }

    private static Path confine(Path root, String path, String kind) {
        Path requested = Paths.get(path);
        Path resolved = requested.isAbsolute()
            ? requested.normalize()
            : root.resolve(requested).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path " + path + " is outside the " + kind + " directory " + root);
        }
        return resolved;
    }
}
