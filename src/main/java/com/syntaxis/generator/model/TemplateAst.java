package com.syntaxis.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * Parsed template shared by both syntaxes.
 *
 * Built fresh for every generation and never mutated. Group references are plain
 * 1-based indices into {@link #getGroups()}.
 */
@Value
public class TemplateAst {

    @NonNull
    List<TemplateGroup> groups;

    @NonNull
    SyntaxVersion syntaxVersion;

    public TemplateAst(List<TemplateGroup> groups, SyntaxVersion syntaxVersion) {
        this.groups = List.copyOf(groups);
        this.syntaxVersion = syntaxVersion;
    }

    public Optional<TemplateGroup> findGroup(int referenceId) {
        if (referenceId < 1 || referenceId > groups.size()) {
            return Optional.empty();
        }
        return Optional.of(groups.get(referenceId - 1));
    }

    public int getTokenCount() {
        return groups.stream().mapToInt(g -> g.getTokens().size()).sum();
    }
}
