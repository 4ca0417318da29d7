package org.neuralchilli.datahub.domain;

import org.junit.jupiter.api.Test;
import org.neuralchilli.datahub.service.CatalogIntegrityException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionKindTest {

    @Test
    void shouldReadKindFromDescriptor() {
        assertThat(ConditionKind.fromDescriptor(Map.of("kind", "success"))).isEqualTo(ConditionKind.SUCCESS);
        assertThat(ConditionKind.fromDescriptor(Map.of("kind", "FORCE"))).isEqualTo(ConditionKind.FORCE);
    }

    @Test
    void shouldDefaultToSuccess() {
        assertThat(ConditionKind.fromDescriptor(null)).isEqualTo(ConditionKind.SUCCESS);
        assertThat(ConditionKind.fromDescriptor(Map.of())).isEqualTo(ConditionKind.SUCCESS);
        assertThat(ConditionKind.fromDescriptor(Map.of("kind", " "))).isEqualTo(ConditionKind.SUCCESS);
    }

    @Test
    void shouldRejectUnknownKind() {
        assertThatThrownBy(() -> ConditionKind.fromDescriptor(Map.of("kind", "maybe")))
                .isInstanceOf(CatalogIntegrityException.class)
                .hasMessageContaining("maybe");
    }
}
