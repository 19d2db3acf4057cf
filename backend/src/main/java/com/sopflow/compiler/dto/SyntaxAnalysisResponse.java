package com.sopflow.compiler.dto;

import java.util.List;

/**
 * Highlighting tokens. {@code error} and {@code errorLine} report the first lexical or
 * structural error; the tokens are still returned in that case.
 */
public record SyntaxAnalysisResponse(
        boolean success,
        List<SyntaxToken> tokens,
        String error,
        Integer errorLine,
        long analysisTimeMs) {

    public static SyntaxAnalysisResponse success(List<SyntaxToken> tokens, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(true, tokens, null, null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse withError(List<SyntaxToken> tokens, String error, int errorLine,
                                                   long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, tokens, error, errorLine > 0 ? errorLine : null, analysisTimeMs);
    }

    public static SyntaxAnalysisResponse error(String error, long analysisTimeMs) {
        return new SyntaxAnalysisResponse(false, List.of(), error, null, analysisTimeMs);
    }
}
