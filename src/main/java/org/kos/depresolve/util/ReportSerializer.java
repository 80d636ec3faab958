package org.kos.depresolve.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.kos.depresolve.model.ConflictDetail;
import org.kos.depresolve.model.DependencyTreeNode;
import org.kos.depresolve.model.ResolutionReport;
import org.kos.depresolve.model.VersionConflict;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Converts resolution reports to JSON
 *
 * Top-level keys: {@code packages}, {@code installation_order},
 * {@code missing_packages}, {@code version_conflicts}, {@code dependency_tree},
 * {@code total_dependencies}, {@code installation_order_degraded} and
 * {@code circular_dependencies}.
 */
public class ReportSerializer {
    private final Gson gson;

    public ReportSerializer() {
        this(true);
    }

    public ReportSerializer(boolean prettyPrint) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (prettyPrint) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String toJson(ResolutionReport report) {
        return gson.toJson(toJsonObject(report));
    }

    public JsonObject toJsonObject(ResolutionReport report) {
        JsonObject json = new JsonObject();
        json.add("packages", toArray(report.getRequested()));
        json.add("installation_order", toArray(report.getInstallationOrder()));
        json.add("missing_packages", toArray(report.getMissing()));

        JsonArray conflicts = new JsonArray();
        for (VersionConflict conflict : report.getVersionConflicts()) {
            conflicts.add(toJsonObject(conflict));
        }
        json.add("version_conflicts", conflicts);

        JsonObject tree = new JsonObject();
        for (Map.Entry<String, DependencyTreeNode> entry : report.getDependencyTree().entrySet()) {
            tree.add(entry.getKey(), toJsonObject(entry.getValue()));
        }
        json.add("dependency_tree", tree);

        json.addProperty("total_dependencies", report.getTotalDependencies());
        json.addProperty("installation_order_degraded", report.isOrderingDegraded());

        JsonArray cycles = new JsonArray();
        for (List<String> cycle : report.getCycles()) {
            cycles.add(toArray(cycle));
        }
        json.add("circular_dependencies", cycles);
        return json;
    }

    public JsonObject toJsonObject(VersionConflict conflict) {
        JsonObject json = new JsonObject();
        json.addProperty("package", conflict.getPackageName());
        JsonArray details = new JsonArray();
        for (ConflictDetail detail : conflict.getConflicts()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("requiring_package", detail.getRequiringPackage());
            entry.addProperty("required_version", detail.getRequiredVersion());
            entry.addProperty("description", detail.getDescription());
            details.add(entry);
        }
        json.add("conflicts", details);
        return json;
    }

    /**
     * Convert a tree node. Circular and not-found leaves carry only their name,
     * their marker and the requirement from their parent edge.
     */
    public JsonObject toJsonObject(DependencyTreeNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("name", node.getName());
        if (node.isCircular()) {
            json.addProperty("circular", true);
        } else if (node.isNotFound()) {
            json.addProperty("not_found", true);
        } else {
            if (node.getVersion() != null) {
                json.addProperty("version", node.getVersion());
            }
            JsonArray children = new JsonArray();
            for (DependencyTreeNode child : node.getDependencies()) {
                children.add(toJsonObject(child));
            }
            json.add("dependencies", children);
            if (node.isTruncated()) {
                json.addProperty("truncated", true);
            }
        }
        if (node.getRequiredVersion() != null) {
            json.addProperty("required_version", node.getRequiredVersion());
        }
        if (node.isOptional()) {
            json.addProperty("optional", true);
        }
        return json;
    }

    private static JsonArray toArray(Collection<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
