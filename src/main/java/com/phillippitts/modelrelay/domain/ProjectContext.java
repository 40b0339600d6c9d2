package com.phillippitts.modelrelay.domain;

import java.util.List;

/**
 * Repository-level context attached to analysis requests.
 */
public record ProjectContext(String projectPath,
                             String gitBranch,
                             String gitCommit,
                             List<String> dependencies,
                             String framework) {

    public ProjectContext {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static ProjectContext of(String projectPath) {
        return new ProjectContext(projectPath, null, null, List.of(), null);
    }
}
