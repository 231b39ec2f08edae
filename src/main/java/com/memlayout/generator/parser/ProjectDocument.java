package com.memlayout.generator.parser;

import java.nio.file.Path;
import java.util.List;

import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A loaded project file: the layout tree and its type alias table.
 */
@Value
@Builder
public class ProjectDocument {

    Path sourcePath;

    @NonNull
    NodeTree tree;

    @NonNull
    @Builder.Default
    TypeAliases typeAliases = TypeAliases.empty();

    /**
     * Non-fatal problems found while loading, e.g. unknown alias kinds.
     */
    @Singular
    List<String> warnings;
}
