package com.flowsentry.analysis;

import com.flowsentry.analysis.domain.BasicBlock;
import com.flowsentry.analysis.domain.CfgDocument;
import com.flowsentry.analysis.domain.FunctionCfg;
import com.flowsentry.analysis.domain.SourceFile;
import com.flowsentry.analysis.domain.SourceRange;
import com.flowsentry.analysis.domain.Statement;
import com.flowsentry.analysis.domain.StatementKind;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the exporter's JSON into the CFG model.
 *
 * Accepts either {@code {"files":[{"path":..,"functions":[..]}]}} or the flat exporter
 * shape {@code {"functions":[{"file":..,..}]}}. Missing statement ids, kinds and use/def
 * facts are derived; structural problems are left for {@link CfgValidator} to report.
 */
public class CfgDocumentReader {

    private static final Logger LOG = LoggerFactory.getLogger(CfgDocumentReader.class);

    private final Gson gson;

    public CfgDocumentReader() {
        this.gson = new GsonBuilder().create();
    }

    // ============================================
    // PUBLIC API
    // ============================================

    public CfgDocument read(Path path) throws CfgFormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new CfgFormatException("Cannot read CFG document " + path + ": " + e.getMessage(), e);
        }
    }

    public CfgDocument parse(String json) throws CfgFormatException {
        return read(new StringReader(json != null ? json : ""), "<string>");
    }

    public CfgDocument read(Reader reader, String origin) throws CfgFormatException {
        DocumentJson document;
        try {
            document = gson.fromJson(reader, DocumentJson.class);
        } catch (JsonParseException e) {
            throw new CfgFormatException("Malformed CFG document " + origin + ": " + e.getMessage(), e);
        }
        if (document == null || (document.files == null && document.functions == null)) {
            throw new CfgFormatException("CFG document " + origin + " contains no files or functions");
        }
        CfgDocument result = toDocument(document, origin);
        LOG.debug("Read {} functions in {} files from {}", result.getFunctionCount(), result.getFiles().size(), origin);
        return result;
    }

    // ============================================
    // CONVERSION
    // ============================================

    private CfgDocument toDocument(DocumentJson document, String origin) {
        CfgDocument result = new CfgDocument();
        if (document.files != null) {
            for (FileJson file : document.files) {
                if (file == null) {
                    continue;
                }
                SourceFile sourceFile = new SourceFile(file.path != null ? file.path : origin);
                addFunctions(sourceFile, file.functions);
                result.addFile(sourceFile);
            }
        }
        if (document.functions != null) {
            Map<String, SourceFile> byPath = new LinkedHashMap<>();
            for (FunctionJson function : document.functions) {
                if (function == null) {
                    continue;
                }
                String path = function.file != null ? function.file : origin;
                SourceFile sourceFile = byPath.computeIfAbsent(path, SourceFile::new);
                List<FunctionJson> single = new ArrayList<>();
                single.add(function);
                addFunctions(sourceFile, single);
            }
            byPath.values().forEach(result::addFile);
        }
        return result;
    }

    private void addFunctions(SourceFile sourceFile, List<FunctionJson> functions) {
        if (functions == null) {
            return;
        }
        int anonymous = 0;
        for (FunctionJson function : functions) {
            if (function == null) {
                continue;
            }
            String name = function.name;
            if (name == null || name.trim().isEmpty()) {
                name = "anonymous_" + anonymous++;
            }
            sourceFile.addFunction(toFunction(function, name, sourceFile.getPath()));
        }
    }

    private FunctionCfg toFunction(FunctionJson json, String name, String file) {
        FunctionCfg cfg = new FunctionCfg(name, file);
        if (json.parameters != null) {
            json.parameters.forEach(cfg::addParameter);
        }
        Set<String> statementIds = new LinkedHashSet<>();
        if (json.blocks != null) {
            for (BlockJson blockJson : json.blocks) {
                if (blockJson == null) {
                    continue;
                }
                if (blockJson.id == null) {
                    cfg.addIngestionProblem("block without id (label " + blockJson.label + ")");
                    continue;
                }
                if (cfg.getBlock(blockJson.id) != null) {
                    cfg.addIngestionProblem("duplicate block id " + blockJson.id);
                    continue;
                }
                cfg.addBasicBlock(toBlock(blockJson, cfg, statementIds));
            }
        }
        cfg.setEntryBlockId(json.entry != null ? json.entry : firstCandidate(cfg, true));
        cfg.setExitBlockId(json.exit != null ? json.exit : firstCandidate(cfg, false));
        return cfg;
    }

    private BasicBlock toBlock(BlockJson json, FunctionCfg cfg, Set<String> statementIds) {
        BasicBlock block = new BasicBlock(json.id, json.label);
        block.setEntryMarker(json.isEntry);
        block.setExitMarker(json.isExit);
        if (json.predecessors != null) {
            json.predecessors.forEach(block::addPredecessor);
        }
        if (json.successors != null) {
            json.successors.forEach(block::addSuccessor);
        }
        if (json.statements != null) {
            int index = 0;
            for (StatementJson statementJson : json.statements) {
                if (statementJson == null) {
                    continue;
                }
                Statement statement = toStatement(statementJson, json.id, index++);
                if (!statementIds.add(statement.getId())) {
                    cfg.addIngestionProblem("duplicate statement id " + statement.getId() + " in block " + json.id);
                }
                block.addStatement(statement);
            }
        }
        return block;
    }

    private Statement toStatement(StatementJson json, String blockId, int index) {
        String text = json.text != null ? json.text.trim() : "";
        String id = json.id != null ? json.id : blockId + "_" + index;
        StatementKind kind = StatementKind.fromLabel(json.type);
        if (kind == null) {
            kind = StatementFactsExtractor.inferKind(text);
        }
        Set<String> defined;
        Set<String> used;
        if (json.variables != null) {
            defined = normalizeAll(json.variables.defined);
            used = normalizeAll(json.variables.used);
        } else {
            defined = StatementFactsExtractor.definedVariables(text);
            used = StatementFactsExtractor.usedVariables(text);
        }
        SourceRange range = null;
        if (json.range != null && json.range.start != null) {
            PositionJson end = json.range.end != null ? json.range.end : json.range.start;
            range = new SourceRange(json.range.start.line, json.range.start.column, end.line, end.column);
        }
        return new Statement(id, kind, text, defined, used, range);
    }

    private static Set<String> normalizeAll(List<String> names) {
        Set<String> normalized = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                if (name != null && !name.trim().isEmpty()) {
                    normalized.add(StatementFactsExtractor.normalize(name));
                }
            }
        }
        return normalized;
    }

    private static String firstCandidate(FunctionCfg cfg, boolean entry) {
        for (BasicBlock block : cfg.getBasicBlocks()) {
            if (entry ? block.isEntryCandidate() : block.isExitCandidate()) {
                return block.getId();
            }
        }
        return null;
    }

    // ============================================
    // JSON SHAPE
    // ============================================

    private static class DocumentJson {
        private List<FileJson> files;
        private List<FunctionJson> functions;
    }

    private static class FileJson {
        private String path;
        private List<FunctionJson> functions;
    }

    private static class FunctionJson {
        private String name;
        private String file;
        private String entry;
        private String exit;
        private List<String> parameters;
        private List<BlockJson> blocks;
    }

    private static class BlockJson {
        private String id;
        private String label;
        private Boolean isEntry;
        private Boolean isExit;
        private List<StatementJson> statements;
        private List<String> predecessors;
        private List<String> successors;
    }

    private static class StatementJson {
        private String id;
        private String type;
        private String text;
        private VariablesJson variables;
        private RangeJson range;
    }

    private static class VariablesJson {
        private List<String> defined;
        private List<String> used;
    }

    private static class RangeJson {
        private PositionJson start;
        private PositionJson end;
    }

    private static class PositionJson {
        private int line;
        private int column;
    }
}
