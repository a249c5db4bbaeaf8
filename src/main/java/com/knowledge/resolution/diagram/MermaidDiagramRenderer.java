package com.knowledge.resolution.diagram;

import com.knowledge.resolution.core.model.MentionRecord;
import com.knowledge.resolution.core.model.RelationObject;
import com.knowledge.resolution.graph.EntityResolutionGraph;
import com.knowledge.resolution.linking.LinkedRelation;
import com.knowledge.resolution.linking.LinkingResult;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an {@link EntityResolutionGraph} as Mermaid {@code graph TD} text for debugging.
 *
 * <p>Each canonical entity becomes a node {@code c<n>} labelled with its mention text and
 * member count. Merged mentions become nodes {@code m<n>} pointing at their canonical node,
 * the edge labelled with the resolution method. When a {@link LinkingResult} is supplied,
 * canonical relations are drawn as dotted edges labelled with the predicate.</p>
 */
public class MermaidDiagramRenderer {

    static final String HEADER = "graph TD";

    public String render(EntityResolutionGraph erg) {
        return render(erg, null);
    }

    public String render(EntityResolutionGraph erg, LinkingResult linkingResult) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        Map<String, String> nodeIds = new HashMap<>();

        int canonicalIndex = 0;
        int memberIndex = 0;
        for (Map.Entry<String, List<MentionRecord>> entry : erg.getMentionsByCanonical().entrySet()) {
            String canonicalId = entry.getKey();
            List<MentionRecord> records = entry.getValue();
            String node = "c" + canonicalIndex++;
            nodeIds.put(canonicalId, node);

            String label = records.stream()
                    .filter(r -> r.mentionId().equals(canonicalId))
                    .map(MentionRecord::text)
                    .findFirst()
                    .orElse(canonicalId);
            sb.append("    ").append(node).append("[\"")
                    .append(escape(label)).append(" (").append(records.size()).append(")\"]\n");

            for (MentionRecord record : records) {
                if (record.mentionId().equals(canonicalId)) {
                    continue;
                }
                String member = "m" + memberIndex++;
                sb.append("    ").append(member).append("(\"").append(escape(record.text())).append("\")")
                        .append(" -->|").append(record.method().name()).append("| ")
                        .append(node).append('\n');
            }
        }

        if (linkingResult != null) {
            appendRelations(sb, linkingResult, nodeIds);
        }
        return sb.toString();
    }

    private void appendRelations(StringBuilder sb, LinkingResult linkingResult, Map<String, String> nodeIds) {
        Map<String, String> external = new LinkedHashMap<>();
        for (LinkedRelation relation : linkingResult.linkedRelations()) {
            String from = nodeFor(relation.canonicalSubjectId(), nodeIds, external, sb);
            RelationObject object = relation.canonicalObject();
            String to = object.isReference()
                    ? nodeFor(object.getReferenceId(), nodeIds, external, sb)
                    : nodeFor("literal:" + object.stringify(), nodeIds, external, sb);
            sb.append("    ").append(from)
                    .append(" -.->|").append(escape(relation.canonicalPredicate())).append("| ")
                    .append(to).append('\n');
        }
    }

    private String nodeFor(String key, Map<String, String> nodeIds, Map<String, String> external, StringBuilder sb) {
        String node = nodeIds.get(key);
        if (node != null) {
            return node;
        }
        return external.computeIfAbsent(key, k -> {
            String id = "x" + external.size();
            String label = k.startsWith("literal:") ? k.substring("literal:".length()) : k;
            sb.append("    ").append(id).append("[/\"").append(escape(label)).append("\"/]\n");
            return id;
        });
    }

    static String escape(String text) {
        return text.replace("\"", "#quot;").replace("|", "#124;").replace("\n", " ");
    }
}
