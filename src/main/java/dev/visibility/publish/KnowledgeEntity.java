package dev.visibility.publish;

import java.util.Map;

/**
 * Entity draft ready for a knowledge base. {@code qid} is set when the entity already exists there.
 */
public record KnowledgeEntity(
        String label,
        String description,
        Map<String, String> claims,
        String qid) {

    public KnowledgeEntity {
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }
}
