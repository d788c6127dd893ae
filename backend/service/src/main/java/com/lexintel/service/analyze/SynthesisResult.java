package com.lexintel.service.analyze;

import com.lexintel.core.model.BriefingSections;
import com.lexintel.core.model.DraftPost;

import java.util.List;

public record SynthesisResult(
        boolean success,
        BriefingSections sections,
        List<DraftPost> drafts,
        int attempts,
        String error
) {
    public SynthesisResult {
        drafts = drafts == null ? List.of() : List.copyOf(drafts);
    }

    static SynthesisResult success(BriefingSections sections, List<DraftPost> drafts, int attempts) {
        return new SynthesisResult(true, sections, drafts, attempts, null);
    }

    static SynthesisResult failure(String error, int attempts) {
        return new SynthesisResult(false, null, List.of(), attempts, error);
    }
}
