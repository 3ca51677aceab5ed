package com.example.printconnector.domain.model.ppd;

import java.util.List;

/**
 * Statements of one PPD document sorted into the buckets the translation cares about.
 *
 * @param openUis      regular UI blocks, each starting with its {@code OpenUI} statement
 * @param installables UI blocks declared inside the {@code InstallableOptions} group
 * @param constraints  {@code UIConstraints} statements
 * @param standalones  statements outside any UI block
 */
public record GroupedStatements(
        List<List<PpdStatement>> openUis,
        List<List<PpdStatement>> installables,
        List<PpdStatement> constraints,
        List<PpdStatement> standalones
) {

    public GroupedStatements {
        openUis = openUis.stream().map(List::copyOf).toList();
        installables = installables.stream().map(List::copyOf).toList();
        constraints = List.copyOf(constraints);
        standalones = List.copyOf(standalones);
    }

    /**
     * Returns a copy with the regular UI blocks replaced.
     *
     * @param filteredOpenUis new regular UI blocks
     * @return grouped statements sharing every other bucket
     */
    public GroupedStatements withOpenUis(List<List<PpdStatement>> filteredOpenUis) {
        return new GroupedStatements(filteredOpenUis, installables, constraints, standalones);
    }
}
