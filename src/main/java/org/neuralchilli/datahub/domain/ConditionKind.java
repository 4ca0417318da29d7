package org.neuralchilli.datahub.domain;

import org.neuralchilli.datahub.service.CatalogIntegrityException;

import java.util.Map;

/**
 * Condition a parent instance must meet before a child may start.
 */
public enum ConditionKind {
    /**
     * Parent succeeded, or failed while marked soft-fail
     */
    SUCCESS,

    /**
     * Parent reached any final state
     */
    FORCE;

    public static final String DESCRIPTOR_KEY = "kind";

    /**
     * Resolve the kind from a catalog edge descriptor such as {@code {kind: success}}.
     * A descriptor without a kind means SUCCESS.
     *
     * @throws CatalogIntegrityException if the kind is not one we know
     */
    public static ConditionKind fromDescriptor(Map<String, String> descriptor) {
        if (descriptor == null) {
            return SUCCESS;
        }
        String kind = descriptor.get(DESCRIPTOR_KEY);
        if (kind == null || kind.isBlank()) {
            return SUCCESS;
        }
        return switch (kind.trim().toLowerCase()) {
            case "success" -> SUCCESS;
            case "force" -> FORCE;
            default -> throw new CatalogIntegrityException(
                    "Unknown dependency condition kind: '" + kind + "'"
            );
        };
    }
}
