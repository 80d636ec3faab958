package org.kos.depresolve.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * All pairwise version conflicts found for one package
 *
 * Both sides of every conflicting pair are listed, so a package required by
 * A and B with incompatible constraints has a detail for A and one for B.
 */
public class VersionConflict {
    private final String packageName;
    private final List<ConflictDetail> conflicts;

    public VersionConflict(String packageName, List<ConflictDetail> conflicts) {
        this.packageName = packageName;
        this.conflicts = new ArrayList<>(conflicts);
    }

    public String getPackageName() {
        return packageName;
    }

    public List<ConflictDetail> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Names of the packages involved in this conflict, in first-seen order.
     */
    public Set<String> getRequiringPackages() {
        Set<String> result = new LinkedHashSet<>();
        for (ConflictDetail detail : conflicts) {
            result.add(detail.getRequiringPackage());
        }
        return result;
    }

    @Override
    public String toString() {
        return "VersionConflict{" +
                "package='" + packageName + '\'' +
                ", conflicts=" + conflicts +
                '}';
    }
}
