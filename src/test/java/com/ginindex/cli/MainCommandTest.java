package com.ginindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseLookupSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("lookup", "part", "body", "a", "b");

        assertNotNull(parseResult.subcommand());
        assertEquals("lookup", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testBuildInspectLookup() throws Exception {
        Path partDir = tempDir.resolve("part_1");
        Path input = tempDir.resolve("rows.txt");
        Files.writeString(input, "cat\ndog\ncat mouse\n");

        String buildOutput = run("build", partDir.toString(), "body", input.toString(), "--threshold", "1");
        assertTrue(buildOutput.contains("构建完成"));
        assertTrue(buildOutput.contains("段数量: 3"));

        String inspectOutput = run("inspect", partDir.toString(), "body", "--format", "json");
        JsonNode summary = new ObjectMapper().readTree(inspectOutput);
        assertEquals("body", summary.get("name").asText());
        assertEquals(1, summary.get("version").asInt());
        assertEquals(3, summary.get("segmentCount").asInt());
        assertEquals(3, summary.get("segments").size());
        assertEquals(2, summary.get("segments").get(0).get("nextRowId").asInt());

        String textOutput = run("inspect", partDir.toString(), "body");
        assertTrue(textOutput.contains("段数量: 3"));

        String lookupOutput = run("lookup", partDir.toString(), "body", "cat", "bird");
        assertTrue(lookupOutput.contains("cat (2 行, 2 段): 1, 3"));
        assertTrue(lookupOutput.contains("bird: 未找到"));
    }

    @Test
    void testBuildWithConfigFile() throws Exception {
        Path partDir = tempDir.resolve("part_2");
        Path input = tempDir.resolve("rows.txt");
        Path config = tempDir.resolve("store.json");
        Files.writeString(input, "a b\nb c\n");
        Files.writeString(config, "{\"segmentDigestionThresholdBytes\": 0}");

        String buildOutput = run("build", partDir.toString(), "body", input.toString(), "--config", config.toString());

        assertTrue(buildOutput.contains("段数量: 1"));
    }

    @Test
    void testInspectMissingStoreReturnsOne() {
        int exitCode = new CommandLine(new MainCommand())
            .execute("inspect", tempDir.resolve("none").toString(), "body");
        assertEquals(1, exitCode);
    }

    private static String run(String... args) {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        int exitCode;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            exitCode = new CommandLine(new MainCommand()).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        assertEquals(0, exitCode, "命令执行失败: " + String.join(" ", args));
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }
}
