package org.kos.depresolve.util;

import org.cyclonedx.Version;
import org.cyclonedx.generators.json.BomJsonGenerator;
import org.cyclonedx.model.Bom;
import org.cyclonedx.model.Component;
import org.cyclonedx.model.Dependency;
import org.cyclonedx.model.Metadata;
import org.cyclonedx.model.metadata.ToolInformation;
import org.kos.depresolve.graph.DependencyGraph;
import org.kos.depresolve.model.DependencyEdge;
import org.kos.depresolve.model.PackageIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds a CycloneDX bill of materials from a resolved dependency graph
 *
 * Every package with a known version becomes a library component whose purl
 * ({@code pkg:kpm/<name>@<version>}) is also its bom-ref. Packages without a
 * version are left out, together with edges that point at them.
 */
public class SbomGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SbomGenerator.class);

    public static final String PURL_TYPE = "kpm";

    private static final String TOOL_NAME = "kpm-resolver";

    /**
     * Build the BOM model.
     *
     * @param graph the dependency graph
     * @return a BOM with components and dependency relationships
     */
    public Bom createBom(DependencyGraph graph) {
        Bom bom = new Bom();
        bom.setSerialNumber("urn:uuid:" + UUID.randomUUID());

        Metadata metadata = new Metadata();
        metadata.setTimestamp(new Date());
        Component toolComponent = new Component();
        toolComponent.setType(Component.Type.APPLICATION);
        toolComponent.setName(TOOL_NAME);
        ToolInformation toolInfo = new ToolInformation();
        List<Component> toolComponents = new ArrayList<>();
        toolComponents.add(toolComponent);
        toolInfo.setComponents(toolComponents);
        metadata.setToolChoice(toolInfo);
        bom.setMetadata(metadata);

        Map<String, String> purlByName = new LinkedHashMap<>();
        List<Component> components = new ArrayList<>();
        for (String name : graph.getNodeNames()) {
            PackageIdentity pkg = graph.getNode(name);
            if (!pkg.hasVersion()) {
                logger.debug("Leaving {} out of SBOM, version unknown", name);
                continue;
            }
            String purl = toPurl(pkg);
            Component component = new Component();
            component.setType(Component.Type.LIBRARY);
            component.setName(name);
            component.setVersion(pkg.getVersion());
            component.setPurl(purl);
            component.setBomRef(purl);
            components.add(component);
            purlByName.put(name, purl);
        }

        // Sort components alphabetically by purl for consistent ordering
        components.sort((c1, c2) -> c1.getPurl().compareTo(c2.getPurl()));
        bom.setComponents(components);

        List<Dependency> dependencies = new ArrayList<>();
        for (Map.Entry<String, String> entry : purlByName.entrySet()) {
            Dependency dependency = new Dependency(entry.getValue());
            Set<String> seen = new LinkedHashSet<>();
            for (DependencyEdge edge : graph.getOutgoing(entry.getKey())) {
                String depPurl = purlByName.get(edge.getTarget().getName());
                if (depPurl != null && seen.add(depPurl)) {
                    dependency.addDependency(new Dependency(depPurl));
                }
            }
            dependencies.add(dependency);
        }
        dependencies.sort((d1, d2) -> d1.getRef().compareTo(d2.getRef()));
        for (Dependency dependency : dependencies) {
            bom.addDependency(dependency);
        }
        return bom;
    }

    /**
     * Build the BOM and render it as CycloneDX 1.6 JSON.
     *
     * @param graph the dependency graph
     * @return the JSON document
     * @throws IllegalStateException if the BOM cannot be rendered
     */
    public String generateJson(DependencyGraph graph) {
        Bom bom = createBom(graph);
        try {
            BomJsonGenerator generator = new BomJsonGenerator(bom, Version.VERSION_16);
            return generator.toJsonString();
        } catch (Exception e) {
            logger.error("Error generating SBOM: {}", e.getMessage(), e);
            throw new IllegalStateException("Error generating SBOM: " + e.getMessage(), e);
        }
    }

    public static String toPurl(PackageIdentity pkg) {
        return "pkg:" + PURL_TYPE + "/" + pkg.getName() + "@" + pkg.getVersion();
    }
}
