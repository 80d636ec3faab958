package org.kos.depresolve.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.kos.depresolve.api.InMemoryMetadataProvider;
import org.kos.depresolve.model.Dependency;
import org.kos.depresolve.model.PackageMetadata;
import org.kos.depresolve.model.ResolutionReport;
import org.kos.depresolve.service.DependencyResolver;
import org.kos.depresolve.service.ResolverConfig;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ReportSerializer class
 */
public class ReportSerializerTest {

    private ResolutionReport sampleReport() {
        InMemoryMetadataProvider live = new InMemoryMetadataProvider();
        live.register(new PackageMetadata("app", "1.0.0", Arrays.asList(
                        new Dependency("lib", "^1.0.0"),
                        new Dependency("tool", ">=2.0"),
                        new Dependency("extra", null, null, true))))
                .register(new PackageMetadata("lib", "1.2.0", Arrays.asList(
                        new Dependency("app", null, null, true),
                        new Dependency("tool", "<=1.0"))))
                .register(new PackageMetadata("tool", "1.5.0", null));
        DependencyResolver resolver = new DependencyResolver(live, new InMemoryMetadataProvider(),
                ResolverConfig.defaults());
        return resolver.generateReport(Collections.singletonList("app"));
    }

    @Test
    public void testTopLevelKeys() {
        JsonObject json = new ReportSerializer().toJsonObject(sampleReport());

        for (String key : Arrays.asList("packages", "installation_order", "missing_packages",
                "version_conflicts", "dependency_tree", "total_dependencies",
                "installation_order_degraded", "circular_dependencies")) {
            assertTrue(json.has(key), "missing key " + key);
        }
        assertEquals("app", json.getAsJsonArray("packages").get(0).getAsString());
        assertEquals(4, json.get("total_dependencies").getAsInt());
        assertFalse(json.get("installation_order_degraded").getAsBoolean());
        assertEquals("extra", json.getAsJsonArray("missing_packages").get(0).getAsString());
    }

    @Test
    public void testConflictEntries() {
        JsonObject json = new ReportSerializer().toJsonObject(sampleReport());

        JsonArray conflicts = json.getAsJsonArray("version_conflicts");
        assertEquals(1, conflicts.size());
        JsonObject conflict = conflicts.get(0).getAsJsonObject();
        assertEquals("tool", conflict.get("package").getAsString());
        JsonObject first = conflict.getAsJsonArray("conflicts").get(0).getAsJsonObject();
        assertEquals("lib", first.get("requiring_package").getAsString());
        assertEquals("<=1.0", first.get("required_version").getAsString());
        assertEquals("Incompatible requirements: <=1.0 vs >=2.0", first.get("description").getAsString());
    }

    @Test
    public void testTreeMarkers() {
        JsonObject tree = new ReportSerializer().toJsonObject(sampleReport())
                .getAsJsonObject("dependency_tree").getAsJsonObject("app");

        assertEquals("1.0.0", tree.get("version").getAsString());
        JsonArray deps = tree.getAsJsonArray("dependencies");
        assertEquals(3, deps.size());

        JsonObject lib = deps.get(0).getAsJsonObject();
        assertEquals("^1.0.0", lib.get("required_version").getAsString());
        JsonObject backEdge = lib.getAsJsonArray("dependencies").get(0).getAsJsonObject();
        assertTrue(backEdge.get("circular").getAsBoolean());
        assertTrue(backEdge.get("optional").getAsBoolean());
        assertFalse(backEdge.has("dependencies"));

        JsonObject extra = deps.get(2).getAsJsonObject();
        assertFalse(extra.has("version"));
        assertTrue(extra.get("optional").getAsBoolean());
    }

    @Test
    public void testJsonStringRoundTripsThroughGson() {
        String text = new ReportSerializer(false).toJson(sampleReport());

        assertFalse(text.contains("\n"));
        JsonObject parsed = JsonParser.parseString(text).getAsJsonObject();
        assertEquals(1, parsed.getAsJsonArray("circular_dependencies").size());
    }
}
