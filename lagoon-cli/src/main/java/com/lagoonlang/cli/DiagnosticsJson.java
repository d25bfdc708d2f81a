package com.lagoonlang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lagoonlang.ir.CompileError;

/**
 * 诊断信息的 JSON 形式（与 LSP publishDiagnostics 的 Diagnostic 结构一致，位置为 0 基）。
 */
final class DiagnosticsJson {

    private static final int SEVERITY_ERROR = 1;
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private DiagnosticsJson() {}

    static JsonArray empty() {
        return new JsonArray();
    }

    static JsonArray of(CompileError error) {
        JsonArray diagnostics = new JsonArray();
        diagnostics.add(diagnostic(error.getFileName(), error.getLine(), error.getColumn(), error.getLength(),
                error.getStage().name(), error.getCode(), error.getMessage()));
        return diagnostics;
    }

    /** 文件级错误（文件不存在、扩展名非法等），没有源码位置 */
    static JsonArray ofFile(String file, String stage, String code, String message) {
        JsonArray diagnostics = new JsonArray();
        diagnostics.add(diagnostic(file, 0, 0, 0, stage, code, message));
        return diagnostics;
    }

    static String toJson(JsonArray diagnostics) {
        return GSON.toJson(diagnostics);
    }

    private static JsonObject diagnostic(String file, int line, int column, int length,
                                         String stage, String code, String message) {
        JsonObject diag = new JsonObject();
        diag.addProperty("file", file);
        diag.add("range", createRange(Math.max(line - 1, 0), Math.max(column - 1, 0), length));
        diag.addProperty("severity", SEVERITY_ERROR);
        diag.addProperty("source", "lagoon");
        diag.addProperty("stage", stage);
        diag.addProperty("code", code);
        diag.addProperty("message", message);
        return diag;
    }

    // end 为 start 之后 length 个字符（不跨行）
    private static JsonObject createRange(int line, int character, int length) {
        JsonObject range = new JsonObject();
        range.add("start", createPosition(line, character));
        range.add("end", createPosition(line, character + length));
        return range;
    }

    private static JsonObject createPosition(int line, int character) {
        JsonObject position = new JsonObject();
        position.addProperty("line", line);
        position.addProperty("character", character);
        return position;
    }
}
