package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.CfgDocument;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.SourceFile;
import com.flowsentry.analysis.domain.Statement;
import com.flowsentry.analysis.domain.StatementKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CfgDocumentReaderTest {

    private final CfgDocumentReader reader = new CfgDocumentReader();

    static Path fixture(String name) {
        try {
            return Paths.get(CfgDocumentReaderTest.class.getResource("/cfg/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void readsFilesShapeFromDisk() throws CfgFormatException {
        CfgDocument document = reader.read(fixture("command.cfg.json"));

        assertEquals(1, document.getFiles().size());
        SourceFile file = document.getFile("src/command.c");
        assertNotNull(file);
        assertEquals(2, document.getFunctionCount());

        FunctionCfg main = document.getFunctionsByName().get("main");
        assertEquals(Arrays.asList("argc", "argv"), main.getParameters());
        assertEquals("0", main.getEntryBlockId());
        assertEquals("2", main.getExitBlockId());
        assertEquals(Arrays.asList("1", "2"), main.getSuccessors("0"));

        Statement assignment = main.getBlock("0").getStatements().get(0);
        assertEquals("s0", assignment.getId());
        assertEquals(StatementKind.ASSIGNMENT, assignment.getKind());
        assertEquals(Collections.singleton("cmd"), assignment.getDefinedVariables());
        assertEquals(Collections.singleton("argv"), assignment.getUsedVariables());
        assertEquals(4, assignment.getRange().getStartLine());
        assertEquals(19, assignment.getRange().getEndColumn());

        Statement condition = main.getBlock("0").getStatements().get(1);
        assertEquals(5, condition.getRange().getEndLine());
    }

    @Test
    void derivesMissingStatementFacts() throws CfgFormatException {
        CfgDocument document = reader.read(fixture("command.cfg.json"));

        Statement call = document.getFunctionsByName().get("main").getBlock("1").getStatements().get(0);
        assertEquals("1_0", call.getId());
        assertEquals(StatementKind.FUNCTION_CALL, call.getKind());
        assertTrue(call.getUsedVariables().contains("cmd"));
        assertNull(call.getRange());

        FunctionCfg run = document.getFunctionsByName().get("run");
        assertEquals("0", run.getEntryBlockId());
        assertEquals("0", run.getExitBlockId());
    }

    @Test
    void readsFlatFunctionsShape() throws CfgFormatException {
        String json = "{\"functions\":["
            + "{\"name\":\"a\",\"file\":\"a.c\",\"blocks\":[{\"id\":1,\"statements\":[{\"text\":\"x = 1;\"}]}]},"
            + "{\"name\":\"b\",\"file\":\"b.c\",\"blocks\":[{\"id\":\"B0\",\"statements\":[]}]},"
            + "{\"file\":\"a.c\",\"blocks\":[{\"id\":\"B0\"}]}"
            + "]}";

        CfgDocument document = reader.parse(json);

        assertEquals(2, document.getFiles().size());
        assertEquals(2, document.getFile("a.c").getFunctions().size());
        assertEquals("anonymous_0", document.getFile("a.c").getFunctions().get(1).getName());
        FunctionCfg a = document.getFunctionsByName().get("a");
        assertEquals("1", a.getEntryBlockId());
        assertEquals(new HashSet<>(Collections.singletonList("x")),
            a.getBlock("1").getStatements().get(0).getDefinedVariables());
    }

    @Test
    void recordsStructuralProblemsWithoutFailing() throws CfgFormatException {
        String json = "{\"files\":[{\"path\":\"dup.c\",\"functions\":[{\"name\":\"f\",\"blocks\":["
            + "{\"id\":\"B0\",\"statements\":[{\"id\":\"s\",\"text\":\"x = 1;\"}]},"
            + "{\"id\":\"B0\"},"
            + "{\"id\":\"B1\",\"statements\":[{\"id\":\"s\",\"text\":\"y = 2;\"}]},"
            + "{\"label\":\"orphan\"}"
            + "]}]}]}";

        FunctionCfg f = reader.parse(json).getFunctionsByName().get("f");

        assertEquals(2, f.getBlockCount());
        assertEquals(3, f.getIngestionProblems().size());
        BasicBlock second = f.getBlock("B1");
        assertEquals(1, second.getStatements().size());
    }

    @Test
    void malformedJsonIsAFormatError() {
        assertThrows(CfgFormatException.class, () -> reader.parse("{\"files\": [ {"));
        assertThrows(CfgFormatException.class, () -> reader.parse("{}"));
        assertThrows(CfgFormatException.class, () -> reader.parse(""));
    }

    @Test
    void missingFileIsAFormatError(@TempDir Path dir) {
        CfgFormatException error = assertThrows(CfgFormatException.class,
            () -> reader.read(dir.resolve("absent.cfg.json")));
        assertTrue(error.getMessage().contains("absent.cfg.json"));
    }
}
