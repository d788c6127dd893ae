package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record SignalThread(
        String theme,
        Category category,
        List<ThreadMember> members
) {
    public SignalThread {
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A signal thread needs at least one member");
        }
    }

    @JsonProperty("sources")
    public Set<String> sources() {
        Set<String> sources = new LinkedHashSet<>();
        for (ThreadMember member : members) {
            sources.add(member.source());
        }
        return sources;
    }

    @JsonProperty("sourceCount")
    public int sourceCount() {
        return sources().size();
    }

    @JsonProperty("confidence")
    public ConfidenceTier confidence() {
        return ConfidenceTier.forDistinctSources(sourceCount());
    }

    @JsonProperty("memberIds")
    public List<String> memberIds() {
        return members.stream().map(ThreadMember::articleId).toList();
    }

    public int maxRelevance() {
        return members.stream().mapToInt(ThreadMember::relevance).max().orElse(0);
    }
}
