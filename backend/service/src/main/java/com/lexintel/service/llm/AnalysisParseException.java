package com.lexintel.service.llm;

public class AnalysisParseException extends Exception {
    public AnalysisParseException(String message) {
        super(message);
    }

    public AnalysisParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
