package com.colorchart.vision.service;

import com.colorchart.vision.config.YamlConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class WorkspacePathsTest {

    @TempDir
    Path dir;

    private WorkspacePaths paths;

    @BeforeEach
    public void setUp() {
        YamlConfig config = new YamlConfig();
        config.getInput().setDirectory(dir.resolve("in").toString());
        config.getOutput().setDirectory(dir.resolve("out").toString());
        paths = new WorkspacePaths();
        ReflectionTestUtils.setField(paths, "yamlConfig", config);
    }

    @Test
    public void testRelativePathsResolveAgainstRoots() {
        assertEquals(dir.resolve("in").resolve("a").resolve("chart.png").toAbsolutePath().normalize(),
            paths.resolveInput("a/chart.png"));
        assertEquals(dir.resolve("out").resolve("run").toAbsolutePath().normalize(),
            paths.resolveOutput("run"));
    }

    @Test
    public void testAbsolutePathInsideRootAccepted() {
        Path inside = dir.resolve("in").resolve("chart.png").toAbsolutePath();
        assertEquals(inside.normalize(), paths.resolveInput(inside.toString()));
    }

    @Test
    public void testEscapingPathsRejected() {
        assertThrows(IllegalArgumentException.class, () -> paths.resolveInput("../secret.png"));
        assertThrows(IllegalArgumentException.class, () -> paths.resolveInput("a/../../secret.png"));
        assertThrows(IllegalArgumentException.class,
            () -> paths.resolveInput(dir.resolve("out").resolve("x.png").toString()));
        assertThrows(IllegalArgumentException.class, () -> paths.resolveOutput("../elsewhere"));
        // 仅前缀相同的兄弟目录不算在根目录内
        assertThrows(IllegalArgumentException.class,
            () -> paths.resolveOutput(dir.resolve("out-other").toString()));
    }
}
